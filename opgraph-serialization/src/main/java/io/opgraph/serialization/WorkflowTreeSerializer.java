package io.opgraph.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.opgraph.core.tree.DanglingReference;
import io.opgraph.core.tree.TreeNode;
import io.opgraph.core.tree.WorkflowTree;
import io.opgraph.core.workflow.node.Node;
import java.io.IOException;
import java.io.Serial;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Writes a `WorkflowTree` as a nested forest for display.
///
/// Each tree node carries its identity (`position`, `id`, `alias`, `type`), the named
/// `paths` of a route or handle as position lists, and its `children` nested recursively.
/// Diagnostics sit next to the roots so a caller can tell a healthy forest from a flat
/// fallback.
///
/// @implNote Write-only. Trees are rebuilt from the node list, never read back.
class WorkflowTreeSerializer extends StdSerializer<WorkflowTree> {

    @Serial private static final long serialVersionUID = 2709936122437517316L;

    WorkflowTreeSerializer() {
        super(WorkflowTree.class);
    }

    @Override
    public void serialize(WorkflowTree tree, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("workflowId", tree.getWorkflowId());
        gen.writeNumberField("size", tree.size());
        gen.writeBooleanField("flatFallback", tree.isFlatFallback());

        gen.writeArrayFieldStart("roots");
        Set<Integer> written = new HashSet<>();
        for (TreeNode root : tree.getRoots()) {
            writeTreeNode(root, gen, written);
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("danglingReferences");
        for (DanglingReference dangling : tree.getDanglingReferences()) {
            gen.writeStartObject();
            gen.writeNumberField("sourcePosition", dangling.sourcePosition());
            if (dangling.sourceAlias() != null) {
                gen.writeStringField("sourceAlias", dangling.sourceAlias());
            }
            gen.writeStringField("kind", dangling.kind().name());
            if (dangling.branch() != null) {
                gen.writeStringField("branch", dangling.branch());
            }
            gen.writeNumberField("missingPosition", dangling.missingPosition());
            gen.writeStringField("message", dangling.describe());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        provider.defaultSerializeField("warnings", tree.getWarnings(), gen);
        gen.writeEndObject();
    }

    private void writeTreeNode(TreeNode treeNode, JsonGenerator gen, Set<Integer> written)
            throws IOException {
        Node node = treeNode.getNode();
        gen.writeStartObject();
        gen.writeNumberField("position", node.getPosition());
        gen.writeStringField("id", node.getUuid());
        if (node.getAlias() != null) {
            gen.writeStringField("alias", node.getAlias());
        }
        gen.writeStringField("type", node.getType().wireName());

        Map<String, List<Integer>> paths = treeNode.getPathPositions();
        if (!paths.isEmpty()) {
            gen.writeObjectFieldStart("paths");
            for (Map.Entry<String, List<Integer>> path : paths.entrySet()) {
                gen.writeArrayFieldStart(path.getKey());
                for (Integer position : path.getValue()) {
                    gen.writeNumber(position);
                }
                gen.writeEndArray();
            }
            gen.writeEndObject();
        }

        gen.writeArrayFieldStart("children");
        if (written.add(node.getPosition())) {
            for (TreeNode child : treeNode.getChildren()) {
                writeTreeNode(child, gen, written);
            }
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
