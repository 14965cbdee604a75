package io.codelab.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** Helpers shared by the node records to assemble their structural children. */
final class Children {

    private Children() {}

    /** The present nodes among {@code nodes}, in order. */
    static List<ASTNode> ofOptional(@Nullable ASTNode... nodes) {
        var result = new ArrayList<ASTNode>(nodes.length);
        for (var node : nodes) {
            if (node != null) {
                result.add(node);
            }
        }
        return List.copyOf(result);
    }

    /** {@code head} if present, followed by {@code tail}. */
    static List<ASTNode> concat(@Nullable ASTNode head, List<? extends ASTNode> tail) {
        if (head == null) {
            return List.copyOf(tail);
        }
        var result = new ArrayList<ASTNode>(tail.size() + 1);
        result.add(head);
        result.addAll(tail);
        return List.copyOf(result);
    }

    static Map<String, Object> metadata(@Nullable Map<String, Object> metadata) {
        return metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
