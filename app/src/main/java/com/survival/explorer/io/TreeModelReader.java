package com.survival.explorer.io;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.annotations.SerializedName;
import com.survival.explorer.core.MalformedTreeException;
import com.survival.explorer.core.TreeModel;
import com.survival.explorer.core.TreeNode;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the nested tree JSON served by the model backend into a validated {@link TreeModel}.
 * Accepts either a bare root node or an object wrapping it under {@code "tree"}.
 */
public class TreeModelReader {

    private final Gson gson = new Gson();

    public TreeModel read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public TreeModel read(String json) {
        return read(new StringReader(json));
    }

    /**
     * @throws MalformedTreeException if the JSON is invalid or describes an invalid tree
     */
    public TreeModel read(Reader reader) {
        JsonElement element;
        try {
            element = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new MalformedTreeException("Invalid tree JSON: " + e.getMessage());
        }
        if (element == null || element.isJsonNull()) {
            return TreeModel.empty();
        }
        if (!element.isJsonObject()) {
            throw new MalformedTreeException("Tree JSON must be an object");
        }

        JsonObject object = element.getAsJsonObject();
        if (object.has("tree")) {
            JsonElement tree = object.get("tree");
            if (tree.isJsonNull()) {
                return TreeModel.empty();
            }
            if (!tree.isJsonObject()) {
                throw new MalformedTreeException("\"tree\" must be an object");
            }
            object = tree.getAsJsonObject();
        }
        if (object.size() == 0) {
            return TreeModel.empty();
        }

        SerializedNode root;
        try {
            root = gson.fromJson(object, SerializedNode.class);
        } catch (JsonParseException e) {
            throw new MalformedTreeException("Invalid tree JSON: " + e.getMessage());
        }

        List<TreeNode> nodes = new ArrayList<>();
        flatten(root, nodes);
        return TreeModel.of(nodes);
    }

    private void flatten(SerializedNode node, List<TreeNode> out) {
        if (node.id == null) {
            throw new MalformedTreeException("Tree node without id");
        }
        List<Integer> childIds = new ArrayList<>();
        if (node.children != null) {
            for (SerializedNode child : node.children) {
                // a null child stays in the list so validation reports it
                childIds.add(child == null ? null : child.id);
            }
        }

        boolean leaf = node.isLeaf != null ? node.isLeaf : childIds.isEmpty();
        int classCount0 = node.class0 == null ? 0 : node.class0;
        int classCount1 = node.class1 == null ? 0 : node.class1;
        int samples = node.samples == null ? classCount0 + classCount1 : node.samples;
        int predicted = node.predictedClass == null
                ? TreeNode.majorityClass(classCount0, classCount1)
                : node.predictedClass;

        out.add(new TreeNode(node.id, leaf, node.feature, node.threshold, childIds,
                samples, classCount0, classCount1, predicted, node.leftLabel, node.rightLabel));

        if (node.children != null) {
            for (SerializedNode child : node.children) {
                if (child != null) {
                    flatten(child, out);
                }
            }
        }
    }

    /**
     * Wire shape of one node.
     */
    static class SerializedNode {
        Integer id;
        String feature;
        Double threshold;
        Integer samples;
        @SerializedName("class_0")
        Integer class0;
        @SerializedName("class_1")
        Integer class1;
        @SerializedName("predicted_class")
        Integer predictedClass;
        @SerializedName("is_leaf")
        Boolean isLeaf;
        @SerializedName("left_label")
        String leftLabel;
        @SerializedName("right_label")
        String rightLabel;
        List<SerializedNode> children;
    }
}
