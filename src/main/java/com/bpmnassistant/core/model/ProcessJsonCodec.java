package com.bpmnassistant.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between the JSON shape of a process and {@link ProcessTree}.
 *
 * decode() expects input that already passed
 * {@link com.bpmnassistant.core.validation.ProcessValidator}; anything else
 * fails with IllegalArgumentException.
 */
@Component
public class ProcessJsonCodec {

    private final ObjectMapper mapper = new ObjectMapper();

    public ProcessTree decode(JsonNode process) {
        return new ProcessTree(decodeSequence(process));
    }

    public ProcessElement decodeElement(JsonNode node) {
        String id = node.path("id").asText();
        ElementType type = ElementType.fromWireName(node.path("type").asText())
                .orElseThrow(() -> new IllegalArgumentException("Unknown element type in " + node));

        switch (type) {
            case EXCLUSIVE_GATEWAY: {
                List<ExclusiveBranch> branches = new ArrayList<>();
                for (JsonNode branch : node.path("branches")) {
                    String next = branch.hasNonNull("next") ? branch.get("next").asText() : null;
                    branches.add(new ExclusiveBranch(
                            branch.path("condition").asText(),
                            decodeSequence(branch.path("path")),
                            next));
                }
                return ProcessElement.exclusiveGateway(id, node.path("label").asText(), branches);
            }
            case PARALLEL_GATEWAY: {
                List<List<ProcessElement>> branches = new ArrayList<>();
                for (JsonNode branch : node.path("branches")) {
                    branches.add(decodeSequence(branch));
                }
                return ProcessElement.parallelGateway(id, branches);
            }
            default:
                return ProcessElement.task(id, type, node.path("label").asText());
        }
    }

    public ArrayNode encode(ProcessTree tree) {
        return encodeSequence(tree.getElements());
    }

    public ObjectNode encodeElement(ProcessElement element) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", element.getType().getWireName());
        node.put("id", element.getId());
        if (element.getLabel() != null) {
            node.put("label", element.getLabel());
        }

        switch (element.getType()) {
            case EXCLUSIVE_GATEWAY: {
                ArrayNode branches = node.putArray("branches");
                for (ExclusiveBranch branch : element.getExclusiveBranches()) {
                    ObjectNode branchNode = branches.addObject();
                    branchNode.put("condition", branch.getCondition());
                    branchNode.set("path", encodeSequence(branch.getPath()));
                    if (branch.getNext() != null) {
                        branchNode.put("next", branch.getNext());
                    }
                }
                break;
            }
            case PARALLEL_GATEWAY: {
                ArrayNode branches = node.putArray("branches");
                for (List<ProcessElement> branch : element.getParallelBranches()) {
                    branches.add(encodeSequence(branch));
                }
                break;
            }
            default:
                break;
        }
        return node;
    }

    /** {@code {"process": [...]}} */
    public ObjectNode wrap(ProcessTree tree) {
        ObjectNode root = mapper.createObjectNode();
        root.set("process", encode(tree));
        return root;
    }

    /** Pretty JSON for prompt substitution. */
    public String toPromptText(ProcessTree tree) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(encode(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render process as JSON", e);
        }
    }

    private List<ProcessElement> decodeSequence(JsonNode sequence) {
        if (sequence == null || !sequence.isArray()) {
            throw new IllegalArgumentException("Expected an array of elements, got: " + sequence);
        }
        List<ProcessElement> elements = new ArrayList<>(sequence.size());
        for (JsonNode node : sequence) {
            elements.add(decodeElement(node));
        }
        return elements;
    }

    private ArrayNode encodeSequence(List<ProcessElement> sequence) {
        ArrayNode array = mapper.createArrayNode();
        for (ProcessElement element : sequence) {
            array.add(encodeElement(element));
        }
        return array;
    }
}
