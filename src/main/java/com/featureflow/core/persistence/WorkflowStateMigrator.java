package com.featureflow.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.featureflow.core.error.StateCorruptedException;
import com.featureflow.core.state.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Upgrades raw state documents to {@link WorkflowState#CURRENT_SCHEMA_VERSION}, one version at a time.
 * <p>
 * Version 1 documents predate explicit skips: they have no {@code skippedPhases}
 * and record finished phases with status {@code "done"}.
 */
public class WorkflowStateMigrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStateMigrator.class);

    static final String VERSION_FIELD = "schemaVersion";

    /** Step that upgrades a document from the key version to the next one. */
    private final Map<Integer, UnaryOperator<ObjectNode>> steps = Map.of(
            1, WorkflowStateMigrator::fromV1
    );

    public ObjectNode migrate(ObjectNode document, Path source) {
        JsonNode versionNode = document.get(VERSION_FIELD);
        if (versionNode != null && !versionNode.canConvertToInt()) {
            throw new StateCorruptedException(source, "schemaVersion is not a number", null);
        }
        int version = versionNode == null ? 1 : versionNode.asInt();
        if (version < 1) {
            throw new StateCorruptedException(source, "unsupported schemaVersion " + version, null);
        }
        if (version > WorkflowState.CURRENT_SCHEMA_VERSION) {
            throw new StateCorruptedException(source,
                    "written by a newer version (schemaVersion " + version + ", supported up to "
                            + WorkflowState.CURRENT_SCHEMA_VERSION + ")", null);
        }

        ObjectNode current = document;
        while (version < WorkflowState.CURRENT_SCHEMA_VERSION) {
            log.info("Migrating workflow state {} from schemaVersion {} to {}", source, version, version + 1);
            current = steps.get(version).apply(current);
            version++;
            current.put(VERSION_FIELD, version);
        }
        return current;
    }

    private static ObjectNode fromV1(ObjectNode doc) {
        if (!doc.has("skippedPhases")) {
            doc.set("skippedPhases", doc.arrayNode());
        }
        JsonNode checkpoints = doc.get("checkpoints");
        if (checkpoints instanceof ObjectNode cps) {
            Iterator<Map.Entry<String, JsonNode>> it = cps.fields();
            while (it.hasNext()) {
                JsonNode cp = it.next().getValue();
                if (cp instanceof ObjectNode node && "done".equals(node.path("status").asText())) {
                    node.put("status", "complete");
                }
            }
        }
        if (!doc.has("completedPhases")) {
            doc.set("completedPhases", doc.arrayNode());
        }
        return doc;
    }
}
