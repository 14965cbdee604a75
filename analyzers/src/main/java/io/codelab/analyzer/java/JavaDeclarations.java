package io.codelab.analyzer.java;

import static io.codelab.analyzer.java.JavaTreeSitterNodeTypes.*;

import io.codelab.analyzer.TreeSitterNodes;
import io.codelab.ast.Parameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Reads declaration headers (modifiers, annotations, throws, supertypes, imports) from Tree-sitter Java nodes. */
final class JavaDeclarations {
    /** Type declaration node types mapped to the kind reported for them. */
    static final Map<String, String> TYPE_KINDS = Map.of(
            CLASS_DECLARATION, "class",
            INTERFACE_DECLARATION, "interface",
            ENUM_DECLARATION, "enum",
            RECORD_DECLARATION, "record",
            ANNOTATION_TYPE_DECLARATION, "annotation");

    private JavaDeclarations() {}

    private static @Nullable TSNode modifiersOf(TSNode declaration) {
        var modifiers = TreeSitterNodes.namedChildrenOfType(declaration, MODIFIERS);
        return modifiers.isEmpty() ? null : modifiers.get(0);
    }

    /** Modifier keywords in source order; annotations are not modifiers. */
    static List<String> modifiers(TSNode declaration) {
        var modifiers = modifiersOf(declaration);
        if (modifiers == null) {
            return List.of();
        }
        var result = new ArrayList<String>();
        for (int i = 0; i < modifiers.getChildCount(); i++) {
            var child = modifiers.getChild(i);
            if (TreeSitterNodes.isPresent(child) && !child.isNamed()) {
                result.add(child.getType());
            }
        }
        return List.copyOf(result);
    }

    /** Annotation names as written, without {@code @} or arguments, e.g. {@code Override} or {@code org.junit.Test}. */
    static List<String> annotations(TSNode declaration, byte[] srcBytes) {
        var modifiers = modifiersOf(declaration);
        if (modifiers == null) {
            return List.of();
        }
        var result = new ArrayList<String>();
        for (var child : TreeSitterNodes.namedChildren(modifiers)) {
            if (MARKER_ANNOTATION.equals(child.getType()) || ANNOTATION.equals(child.getType())) {
                result.add(TreeSitterNodes.text(TreeSitterNodes.field(child, FIELD_NAME), srcBytes));
            }
        }
        return List.copyOf(result);
    }

    /** Exception types of a method's {@code throws} clause, as written. */
    static List<String> throwsTypes(TSNode method, byte[] srcBytes) {
        var clauses = TreeSitterNodes.namedChildrenOfType(method, THROWS);
        if (clauses.isEmpty()) {
            return List.of();
        }
        return TreeSitterNodes.namedChildren(clauses.get(0)).stream()
                .map(type -> TreeSitterNodes.text(type, srcBytes))
                .toList();
    }

    /** The type's name without type arguments: {@code Base<T>} becomes {@code Base}. */
    static String rawTypeName(TSNode type, byte[] srcBytes) {
        if (GENERIC_TYPE.equals(type.getType())) {
            var raw = TreeSitterNodes.firstNamedChild(type);
            if (raw != null) {
                return TreeSitterNodes.text(raw, srcBytes);
            }
        }
        return TreeSitterNodes.text(type, srcBytes);
    }

    static @Nullable String superclass(TSNode declaration, byte[] srcBytes) {
        var superclass = TreeSitterNodes.field(declaration, FIELD_SUPERCLASS);
        if (superclass == null) {
            return null;
        }
        var type = TreeSitterNodes.firstNamedChild(superclass);
        return type == null ? null : rawTypeName(type, srcBytes);
    }

    /** Implemented interfaces of a class, enum or record, or the extended interfaces of an interface. */
    static List<String> interfaces(TSNode declaration, byte[] srcBytes) {
        var interfacesNode = TreeSitterNodes.field(declaration, FIELD_INTERFACES);
        if (interfacesNode == null) {
            var extendsInterfaces = TreeSitterNodes.namedChildrenOfType(declaration, EXTENDS_INTERFACES);
            interfacesNode = extendsInterfaces.isEmpty() ? null : extendsInterfaces.get(0);
        }
        if (interfacesNode == null) {
            return List.of();
        }
        var result = new ArrayList<String>();
        for (var typeList : TreeSitterNodes.namedChildrenOfType(interfacesNode, TYPE_LIST)) {
            for (var type : TreeSitterNodes.namedChildren(typeList)) {
                result.add(rawTypeName(type, srcBytes));
            }
        }
        return List.copyOf(result);
    }

    /** Formal parameters with their declared types; a varargs parameter's type ends in {@code ...}. */
    static List<Parameter> parameters(@Nullable TSNode parametersNode, byte[] srcBytes) {
        if (parametersNode == null) {
            return List.of();
        }
        var result = new ArrayList<Parameter>();
        for (var param : TreeSitterNodes.namedChildren(parametersNode)) {
            if (FORMAL_PARAMETER.equals(param.getType())) {
                var type = TreeSitterNodes.field(param, FIELD_TYPE);
                result.add(new Parameter(
                        TreeSitterNodes.text(TreeSitterNodes.field(param, FIELD_NAME), srcBytes),
                        type == null ? null : TreeSitterNodes.text(type, srcBytes),
                        null,
                        false));
            } else if (SPREAD_PARAMETER.equals(param.getType())) {
                String name = "";
                String type = null;
                for (var child : TreeSitterNodes.namedChildren(param)) {
                    if (VARIABLE_DECLARATOR.equals(child.getType())) {
                        name = TreeSitterNodes.text(TreeSitterNodes.field(child, FIELD_NAME), srcBytes);
                    } else if (!MODIFIERS.equals(child.getType()) && type == null) {
                        type = TreeSitterNodes.text(child, srcBytes) + "...";
                    }
                }
                result.add(new Parameter(name, type, null, true));
            }
        }
        return List.copyOf(result);
    }

    /** The package name, or null when the file has no package declaration. */
    static @Nullable String packageName(TSNode root, byte[] srcBytes) {
        for (var declaration : TreeSitterNodes.namedChildrenOfType(root, PACKAGE_DECLARATION)) {
            for (var child : TreeSitterNodes.namedChildren(declaration)) {
                if (IDENTIFIER.equals(child.getType()) || SCOPED_IDENTIFIER.equals(child.getType())) {
                    return TreeSitterNodes.text(child, srcBytes);
                }
            }
        }
        return null;
    }

    /**
     * Imported paths in source order. Static imports are listed by path like any other; on-demand imports keep their
     * trailing {@code .*}.
     */
    static List<String> imports(TSNode root, byte[] srcBytes) {
        var result = new ArrayList<String>();
        for (var declaration : TreeSitterNodes.namedChildrenOfType(root, IMPORT_DECLARATION)) {
            String path = null;
            boolean onDemand = false;
            for (var child : TreeSitterNodes.namedChildren(declaration)) {
                if (IDENTIFIER.equals(child.getType()) || SCOPED_IDENTIFIER.equals(child.getType())) {
                    path = TreeSitterNodes.text(child, srcBytes);
                } else if (ASTERISK.equals(child.getType())) {
                    onDemand = true;
                }
            }
            if (path != null) {
                result.add(onDemand ? path + ".*" : path);
            }
        }
        return List.copyOf(result);
    }
}
