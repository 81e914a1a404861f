package io.opgraph.core.record;

import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.state.VariablePath;
import io.opgraph.core.template.TemplateResolver;
import io.opgraph.core.template.VariableLookup;
import io.opgraph.core.util.Values;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Creates records from extracted items.
///
/// A plain type such as `email` yields sequential ids `email_001`, `email_002`, continuing
/// after the highest existing number of that type. A spec map `{type, id_pattern}` derives
/// each id from a template resolved against the item, for example `email_{{sender}}`.
/// Records are upserted, so re-running an extraction refreshes `fields` without duplicates.
///
/// {@snippet :
/// List<WorkflowRecord> created = factory.createRecords(
///         "wf-1", Map.of("type", "email", "id_pattern", "email_{{id}}"), items, "extract_mails");
/// }
public class RecordFactory {

    private static final Logger logger = Logger.getLogger(RecordFactory.class.getName());

    private final RecordStore recordStore;
    private final TemplateResolver templateResolver;

    public RecordFactory(RecordStore recordStore, TemplateResolver templateResolver) {
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore must not be null");
        this.templateResolver =
                Objects.requireNonNull(templateResolver, "templateResolver must not be null");
    }

    /// @param workflowId owning workflow, not null
    /// @param spec record type string, or a map with `type` and optional `id_pattern`
    /// @param items extracted items; maps become `fields`, scalars become `fields.value`
    /// @param iterationNodeAlias alias of the node that discovered the items, may be null
    /// @return the stored records, in item order
    /// @throws ValidationException if the spec has no type or a pattern leaves a placeholder
    public List<WorkflowRecord> createRecords(
            String workflowId, Object spec, List<?> items, String iterationNodeAlias) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(items, "items must not be null");

        Map<String, Object> specMap = Values.asMap(spec);
        Object rawType = specMap != null ? specMap.get("type") : spec;
        if (Values.isBlank(rawType)) {
            throw new ValidationException("create_records.type", "record type is required");
        }
        String type = String.valueOf(rawType);
        String idPattern = specMap != null && specMap.get("id_pattern") != null
                ? String.valueOf(specMap.get("id_pattern"))
                : null;

        int sequence = highestSequence(workflowId, type);
        List<WorkflowRecord> created = new ArrayList<>(items.size());
        for (Object item : items) {
            Map<String, Object> fields = fieldsOf(item);
            String recordId = idPattern != null
                    ? patternId(idPattern, fields)
                    : String.format("%s_%03d", type, ++sequence);
            WorkflowRecord record =
                    WorkflowRecord.builder()
                            .workflowId(workflowId)
                            .recordId(recordId)
                            .recordType(type)
                            .iterationNodeAlias(iterationNodeAlias)
                            .data(Map.of(WorkflowRecord.FIELDS, fields))
                            .build();
            WorkflowRecord existing = recordStore.find(workflowId, recordId).orElse(null);
            if (existing != null) {
                Map<String, Object> data = Values.mutableMap(existing.getData());
                data.put(WorkflowRecord.FIELDS, fields);
                record = existing.toBuilder().data(data).build();
            }
            created.add(recordStore.save(record, SaveMode.UPSERT));
        }
        logger.info(
                "Created or refreshed "
                        + created.size()
                        + " '"
                        + type
                        + "' record(s) in workflow "
                        + workflowId);
        return created;
    }

    private String patternId(String idPattern, Map<String, Object> fields) {
        VariableLookup lookup = path -> VariablePath.navigate(fields, VariablePath.parse(path));
        String id = templateResolver.resolve(idPattern, lookup);
        if (id.contains("{{")) {
            throw new ValidationException(
                    "create_records.id_pattern",
                    "'" + idPattern + "' left unresolved placeholders: " + id);
        }
        return id;
    }

    private int highestSequence(String workflowId, String type) {
        Pattern numbered = Pattern.compile(Pattern.quote(type) + "_(\\d+)");
        int highest = 0;
        for (WorkflowRecord record : recordStore.queryRecords(workflowId, type + "_*")) {
            Matcher m = numbered.matcher(record.getRecordId());
            // ids numbered at the int limit or beyond are not part of the sequence
            Integer sequence = m.matches() ? Values.toInteger(m.group(1)) : null;
            if (sequence != null && sequence < Integer.MAX_VALUE) {
                highest = Math.max(highest, sequence);
            }
        }
        return highest;
    }

    private static Map<String, Object> fieldsOf(Object item) {
        if (item instanceof Map<?, ?>) {
            return Values.mutableMap(item);
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("value", Values.deepCopy(item));
        return fields;
    }
}
