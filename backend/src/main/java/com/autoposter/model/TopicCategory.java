package com.autoposter.model;

import java.util.List;

/**
 * Fixed set of content categories. Each category carries the hashtag pool and the
 * colour theme used when rendering post images.
 */
public enum TopicCategory {

    BITCOIN("Bitcoin",
            List.of("#Bitcoin", "#BTC", "#Cryptocurrency", "#Crypto", "#DigitalGold",
                    "#BitcoinHalving", "#HODL", "#Satoshi", "#Blockchain", "#BitcoinMining",
                    "#CryptoTrading", "#BitcoinWallet", "#BitcoinSecurity", "#BitcoinAdoption",
                    "#BitcoinEducation", "#SoundMoney", "#BitcoinDevelopment", "#BitcoinTech",
                    "#Hyperbitcoinization", "#BTCPayServer", "#BitcoinNode", "#BitcoinCore",
                    "#BitcoinPrice", "#BitcoinInvesting", "#BitcoinCommunity"),
            List.of("#F7931A", "#4D4D4D", "#FFFFFF", "#000000")),

    LIGHTNING_NETWORK("Lightning Network",
            List.of("#LightningNetwork", "#LN", "#Bitcoin", "#BTC", "#LightningNode",
                    "#LightningWallet", "#LightningPayments", "#LightningApps", "#LightningDev",
                    "#LightningTip", "#LightningChannels", "#LightningLabs", "#LightningLoop",
                    "#LightningPool", "#LightningTerminal", "#LightningAddress", "#LNURL",
                    "#LightningPrivacy", "#LightningAdoption", "#InstantPayments", "#Micropayments",
                    "#LightningInvoice", "#LightningTorch", "#NodeRunners", "#LightningHackday"),
            List.of("#792EE5", "#FFFFFF", "#000000", "#F7931A")),

    NOSTR("Nostr",
            List.of("#Nostr", "#NostrRelay", "#NostrClient", "#NostrProtocol", "#NostrDev",
                    "#NostrNIP", "#NostrEvents", "#NostrPubkey", "#NostrPrivkey", "#NostrZaps",
                    "#NostrNotes", "#NostrDMs", "#NostrCommunity", "#NostrAdoption", "#NostrApps",
                    "#DecentralizedSocial", "#NostrTools", "#NostrHackathon", "#NostrIntegration",
                    "#NostrIdentity", "#NostrPrivacy", "#NostrSecurity", "#NostrUI", "#NostrUX",
                    "#NostrStandards"),
            List.of("#8E44AD", "#FFFFFF", "#000000", "#3498DB")),

    PRIVACY("Privacy",
            List.of("#Privacy", "#OnlinePrivacy", "#DigitalPrivacy", "#PrivacyMatters", "#PrivacyTools",
                    "#PrivacyByDesign", "#DataPrivacy", "#PrivacyRights", "#PrivacyProtection", "#OPSEC",
                    "#PrivacyAdvocate", "#PrivacyAwareness", "#PrivacyTips", "#PrivacyTech", "#Encryption",
                    "#EndToEndEncryption", "#VPN", "#Tor", "#PrivacyFocus", "#PrivacyFirst",
                    "#PrivacyPolicy", "#PrivacySettings", "#PrivacyControl", "#PrivacyEducation",
                    "#SecureMessaging"),
            List.of("#2C3E50", "#ECF0F1", "#000000", "#3498DB")),

    NODE_SETUP("Node Setup",
            List.of("#NodeSetup", "#BitcoinNode", "#LightningNode", "#NostrRelay", "#SelfHosted",
                    "#NodeRunner", "#FullNode", "#NodeMaintenance", "#NodeSecurity", "#NodeBackup",
                    "#NodeMonitoring", "#RaspberryPi", "#UmbrelNode", "#StartOSNode", "#MyNodeBTC",
                    "#DIYNode", "#NodeHardware", "#NodeSoftware", "#NodeConfiguration", "#NodeUpgrade",
                    "#NodeTroubleshooting", "#NodePerformance", "#NodeSync", "#NodeCommunity",
                    "#SelfSovereignty"),
            List.of("#27AE60", "#FFFFFF", "#000000", "#F1C40F"));

    private final String displayName;
    private final List<String> hashtagPool;
    private final List<String> themeColors;

    TopicCategory(String displayName, List<String> hashtagPool, List<String> themeColors) {
        this.displayName = displayName;
        this.hashtagPool = hashtagPool;
        this.themeColors = themeColors;
    }

    public String displayName() {
        return displayName;
    }

    public List<String> hashtagPool() {
        return hashtagPool;
    }

    /**
     * Theme colours as hex strings: primary, secondary, dark, accent.
     */
    public List<String> themeColors() {
        return themeColors;
    }
}
