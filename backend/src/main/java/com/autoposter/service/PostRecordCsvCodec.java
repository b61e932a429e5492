package com.autoposter.service;

import com.autoposter.model.CycleTrigger;
import com.autoposter.model.FailureReason;
import com.autoposter.model.FailureStage;
import com.autoposter.model.GenerationMethod;
import com.autoposter.model.PostRecord;
import com.autoposter.model.PostStatus;
import com.autoposter.model.TopicCategory;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * RFC 4180 CSV export and import of post records. {@link #parse} accepts exactly what
 * {@link #toCsv} produces and rebuilds equal field values.
 */
public final class PostRecordCsvCodec {

    static final List<String> HEADER = List.of(
            "Id",
            "Date",
            "Status",
            "Category",
            "Topic Id",
            "Topic",
            "Content",
            "Hashtags",
            "Post Id",
            "Image",
            "Failure Reason",
            "Failure Stage",
            "Failure Detail",
            "Generation Method",
            "Trigger",
            "Attempts"
    );

    private static final String LINE_BREAK = "\r\n";

    private PostRecordCsvCodec() {
    }

    public static String toCsv(Iterable<PostRecord> records) {
        StringBuilder csv = new StringBuilder();
        appendRow(csv, HEADER);
        for (PostRecord record : records) {
            appendRow(csv, Arrays.asList(
                    text(record.getId()),
                    text(record.getCreatedAt()),
                    text(record.getStatus()),
                    text(record.getCategory()),
                    text(record.getTopicId()),
                    text(record.getTopicName()),
                    text(record.getBodyText()),
                    record.getHashtags() == null ? "" : String.join(" ", record.getHashtags()),
                    text(record.getPlatformPostId()),
                    text(record.getImageRef()),
                    text(record.getFailureReason()),
                    text(record.getFailureStage()),
                    text(record.getFailureDetail()),
                    text(record.getGenerationMethod()),
                    text(record.getTrigger()),
                    String.valueOf(record.getAttemptCount())
            ));
        }
        return csv.toString();
    }

    public static List<PostRecord> parse(String csv) {
        if (csv == null) {
            throw new IllegalArgumentException("CSV content is required");
        }
        List<List<String>> rows = splitRows(csv);
        if (rows.isEmpty() || !HEADER.equals(rows.get(0))) {
            throw new IllegalArgumentException("CSV header does not match the post history export format");
        }

        List<PostRecord> records = new ArrayList<>(rows.size() - 1);
        for (int i = 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row.size() != HEADER.size()) {
                throw new IllegalArgumentException("CSV row " + i + " has " + row.size()
                        + " fields, expected " + HEADER.size());
            }
            records.add(toRecord(row, i));
        }
        return records;
    }

    private static PostRecord toRecord(List<String> row, int rowNumber) {
        try {
            return PostRecord.builder()
                    .id(value(row.get(0), Long::valueOf))
                    .createdAt(value(row.get(1), OffsetDateTime::parse))
                    .status(value(row.get(2), PostStatus::valueOf))
                    .category(value(row.get(3), TopicCategory::valueOf))
                    .topicId(value(row.get(4), Long::valueOf))
                    .topicName(value(row.get(5), Function.identity()))
                    .bodyText(value(row.get(6), Function.identity()))
                    .hashtags(row.get(7).isEmpty() ? List.of() : List.of(row.get(7).split(" ")))
                    .platformPostId(value(row.get(8), Function.identity()))
                    .imageRef(value(row.get(9), Function.identity()))
                    .failureReason(value(row.get(10), FailureReason::valueOf))
                    .failureStage(value(row.get(11), FailureStage::valueOf))
                    .failureDetail(value(row.get(12), Function.identity()))
                    .generationMethod(value(row.get(13), GenerationMethod::valueOf))
                    .trigger(value(row.get(14), CycleTrigger::valueOf))
                    .attemptCount(Integer.parseInt(row.get(15)))
                    .build();
        } catch (DateTimeParseException | IllegalArgumentException ex) {
            throw new IllegalArgumentException("CSV row " + rowNumber + " is invalid: " + ex.getMessage(), ex);
        }
    }

    private static <T> T value(String raw, Function<String, T> parser) {
        return raw.isEmpty() ? null : parser.apply(raw);
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString();
    }

    private static void appendRow(StringBuilder csv, List<String> fields) {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                csv.append(',');
            }
            csv.append(quote(fields.get(i)));
        }
        csv.append(LINE_BREAK);
    }

    static String quote(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0 && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }

    static List<List<String>> splitRows(String csv) {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (i < csv.length()) {
            char c = csv.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < csv.length() && csv.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                row.add(field.toString());
                field.setLength(0);
            } else if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < csv.length() && csv.charAt(i + 1) == '\n') {
                    i++;
                }
                row.add(field.toString());
                field.setLength(0);
                rows.add(row);
                row = new ArrayList<>();
            } else {
                field.append(c);
            }
            i++;
        }
        if (quoted) {
            throw new IllegalArgumentException("CSV ends inside a quoted field");
        }
        if (field.length() > 0 || !row.isEmpty()) {
            row.add(field.toString());
            rows.add(row);
        }
        return rows;
    }
}
