package io.cflow.extract;

import io.cflow.model.*;
import io.cflow.parser.ParsedModule;
import io.cflow.parser.SourceText;
import org.treesitter.TSNode;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

import static io.cflow.parser.PythonNodeTypes.*;

/**
 * Walks a parsed module and collects its classes, its definitions and, for
 * every definition, the call sites and assignments of its own body.
 * <p>
 * Scoping rules:
 * <ul>
 *   <li>A function whose immediate enclosing scope is a class body is a method
 *       ({@code __init__} is the constructor); every other function, however
 *       deeply nested, is registered as a module-level function.</li>
 *   <li>Calls inside a nested definition belong to that definition only.</li>
 *   <li>Calls inside a lambda belong to the enclosing definition.</li>
 *   <li>Calls outside any definition (module or class level code) are ignored.</li>
 * </ul>
 * Instances are stateless and may be shared between threads.
 */
public class DefinitionExtractor {

    /**
     * Extract everything from one module.
     */
    public ExtractedFile extract(ParsedModule module) {
        Walk walk = new Walk(module.file(), module.source());
        walk.walk(module.root());
        List<ExtractedDefinition> definitions = new ArrayList<>(walk.bodies.size());
        for (Body body : walk.bodies) {
            body.assignments.sort(Comparator.comparingInt(Assignment::offset));
            definitions.add(new ExtractedDefinition(body.definition, body.callSites, body.assignments));
        }
        return new ExtractedFile(module.file(), walk.classes, definitions);
    }

    /**
     * Mutable collector for the definition currently being walked.
     */
    private static final class Body {
        private final Definition definition;
        private final List<CallSite> callSites = new ArrayList<>();
        private final List<Assignment> assignments = new ArrayList<>();

        private Body(Definition definition) {
            this.definition = definition;
        }
    }

    /**
     * A pending visit, or with {@code exit} set, the point where all children of {@code node} are done.
     */
    private record Frame(TSNode node, String classScope, Body owner, boolean exit) {
    }

    /**
     * State of one traversal.
     */
    private static final class Walk {
        private final Path file;
        private final SourceText source;
        private final List<ClassDeclaration> classes = new ArrayList<>();
        private final List<Body> bodies = new ArrayList<>();

        private Walk(Path file, SourceText source) {
            this.file = file;
            this.source = source;
        }

        /**
         * Walks the subtree under {@code root} depth first, children in document order.
         * Calls are recorded once their children are done, so that a call nested in
         * another call's callee or arguments comes first.
         */
        void walk(TSNode root) {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(root, null, null, false));
            while (!stack.isEmpty()) {
                Frame frame = stack.pop();
                TSNode node = frame.node();
                Body owner = frame.owner();
                if (frame.exit()) {
                    leave(node, owner);
                    continue;
                }
                switch (node.getType()) {
                    case CLASS_DEFINITION -> enterClass(node, owner, stack);
                    case FUNCTION_DEFINITION -> enterFunction(node, frame.classScope(), owner, stack);
                    case CALL, ASSIGNMENT, AUGMENTED_ASSIGNMENT, NAMED_EXPRESSION, AS_PATTERN -> {
                        if (owner != null) {
                            stack.push(new Frame(node, frame.classScope(), owner, true));
                        }
                        pushChildren(node, frame.classScope(), owner, stack);
                    }
                    case FOR_STATEMENT -> {
                        if (owner != null) {
                            recordLoopTarget(node, owner);
                        }
                        pushChildren(node, frame.classScope(), owner, stack);
                    }
                    case EXCEPT_CLAUSE -> {
                        if (owner != null) {
                            recordExceptAlias(node, owner);
                        }
                        pushChildren(node, frame.classScope(), owner, stack);
                    }
                    default -> pushChildren(node, frame.classScope(), owner, stack);
                }
            }
        }

        private void leave(TSNode node, Body owner) {
            switch (node.getType()) {
                case CALL -> owner.callSites.add(callSite(node));
                case ASSIGNMENT -> recordAssignment(node, owner);
                case AUGMENTED_ASSIGNMENT -> clearTarget(node.getChildByFieldName(FIELD_LEFT), node.getEndByte(), owner);
                case NAMED_EXPRESSION -> {
                    TSNode name = node.getChildByFieldName(FIELD_NAME);
                    TSNode value = node.getChildByFieldName(FIELD_VALUE);
                    if (isPresent(name) && isPresent(value)) {
                        owner.assignments.add(new Assignment(source.text(name), constructorCandidate(value),
                                node.getEndByte()));
                    }
                }
                case AS_PATTERN -> clearTarget(node.getChildByFieldName(FIELD_ALIAS), node.getEndByte(), owner);
                default -> {
                }
            }
        }

        private void pushChildren(TSNode node, String classScope, Body owner, Deque<Frame> stack) {
            for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getNamedChild(i);
                if (isPresent(child)) {
                    stack.push(new Frame(child, classScope, owner, false));
                }
            }
        }

        private void enterClass(TSNode node, Body owner, Deque<Frame> stack) {
            String name = source.text(node.getChildByFieldName(FIELD_NAME));
            classes.add(new ClassDeclaration(name, baseNames(node), location(node)));

            TSNode body = node.getChildByFieldName(FIELD_BODY);
            if (isPresent(body)) {
                pushChildren(body, name, owner, stack);
            }
        }

        private void enterFunction(TSNode node, String classScope, Body owner, Deque<Frame> stack) {
            String name = source.text(node.getChildByFieldName(FIELD_NAME));
            Definition.Builder builder = Definition.builder()
                    .name(name)
                    .parameters(parameterNames(node.getChildByFieldName(FIELD_PARAMETERS)))
                    .location(location(node))
                    .isAsync(isAsync(node));
            if (classScope != null) {
                builder.memberOf(classScope);
            }
            Body body = new Body(builder.build());
            bodies.add(body);

            TSNode block = node.getChildByFieldName(FIELD_BODY);
            if (isPresent(block)) {
                pushChildren(block, null, body, stack);
            }
            // Default values run in the enclosing scope
            TSNode parameters = node.getChildByFieldName(FIELD_PARAMETERS);
            if (isPresent(parameters)) {
                pushChildren(parameters, null, owner, stack);
            }
        }

        private CallSite callSite(TSNode call) {
            TSNode function = call.getChildByFieldName(FIELD_FUNCTION);
            int arguments = argumentCount(call.getChildByFieldName(FIELD_ARGUMENTS));
            SourceLocation location = location(call);
            int offset = call.getEndByte();

            String type = isPresent(function) ? function.getType() : "";
            if (IDENTIFIER.equals(type)) {
                return CallSite.bare(source.text(function), arguments, location, offset);
            }
            if (ATTRIBUTE.equals(type)) {
                TSNode object = function.getChildByFieldName(FIELD_OBJECT);
                TSNode attribute = function.getChildByFieldName(FIELD_ATTRIBUTE);
                if (isPresent(object) && isPresent(attribute)) {
                    return CallSite.attribute(compact(source.text(object)), source.text(attribute),
                            arguments, location, offset);
                }
            }
            return CallSite.other(compact(source.text(function)), arguments, location, offset);
        }

        private void recordAssignment(TSNode node, Body owner) {
            TSNode left = node.getChildByFieldName(FIELD_LEFT);
            TSNode value = node.getChildByFieldName(FIELD_RIGHT);
            if (!isPresent(left) || !isPresent(value)) {
                // Annotation only, nothing is bound
                return;
            }
            // a = b = Foo(): the inner assignment records b itself
            while (ASSIGNMENT.equals(value.getType())) {
                TSNode inner = value.getChildByFieldName(FIELD_RIGHT);
                if (!isPresent(inner)) {
                    return;
                }
                value = inner;
            }
            int offset = node.getEndByte();
            String candidate = constructorCandidate(value);

            String leftType = left.getType();
            if (IDENTIFIER.equals(leftType) || ATTRIBUTE.equals(leftType)) {
                owner.assignments.add(new Assignment(compact(source.text(left)), candidate, offset));
            } else {
                // Unpacking never binds a tracked class, it only clears
                clearTarget(left, offset, owner);
            }
        }

        /**
         * The loop variable is rebound before the body runs, so the binding takes
         * effect at the end of the iterable.
         */
        private void recordLoopTarget(TSNode node, Body owner) {
            TSNode right = node.getChildByFieldName(FIELD_RIGHT);
            int offset = isPresent(right) ? right.getEndByte() : node.getStartByte();
            clearTarget(node.getChildByFieldName(FIELD_LEFT), offset, owner);
        }

        /**
         * Older grammars spell {@code except E as e} without an {@code as_pattern}.
         */
        private void recordExceptAlias(TSNode node, Body owner) {
            TSNode alias = node.getChildByFieldName(FIELD_ALIAS);
            if (!isPresent(alias)) {
                int count = node.getChildCount();
                for (int i = 0; i + 1 < count; i++) {
                    TSNode child = node.getChild(i);
                    if (isPresent(child) && AS.equals(child.getType())) {
                        alias = node.getChild(i + 1);
                        break;
                    }
                }
            }
            if (isPresent(alias)) {
                clearTarget(alias, alias.getEndByte(), owner);
            }
        }

        /**
         * Records that {@code target} no longer holds a known class.
         */
        private void clearTarget(TSNode target, int offset, Body owner) {
            if (!isPresent(target)) {
                return;
            }
            if (AS_PATTERN_TARGET.equals(target.getType())) {
                if (target.getNamedChildCount() == 0) {
                    owner.assignments.add(new Assignment(compact(source.text(target)), null, offset));
                    return;
                }
                target = target.getNamedChild(0);
            }
            switch (target.getType()) {
                case IDENTIFIER, ATTRIBUTE ->
                        owner.assignments.add(new Assignment(compact(source.text(target)), null, offset));
                case PATTERN_LIST, TUPLE_PATTERN, LIST_PATTERN, TUPLE, LIST -> {
                    List<String> targets = new ArrayList<>();
                    collectTargets(target, targets);
                    for (String name : targets) {
                        owner.assignments.add(new Assignment(name, null, offset));
                    }
                }
                default -> {
                }
            }
        }

        private void collectTargets(TSNode pattern, List<String> targets) {
            int count = pattern.getNamedChildCount();
            for (int i = 0; i < count; i++) {
                TSNode child = pattern.getNamedChild(i);
                if (!isPresent(child)) {
                    continue;
                }
                switch (child.getType()) {
                    case IDENTIFIER, ATTRIBUTE -> targets.add(compact(source.text(child)));
                    case PATTERN_LIST, TUPLE_PATTERN, LIST_PATTERN, TUPLE, LIST, LIST_SPLAT_PATTERN ->
                            collectTargets(child, targets);
                    default -> {
                    }
                }
            }
        }

        private String constructorCandidate(TSNode value) {
            if (!CALL.equals(value.getType())) {
                return null;
            }
            TSNode function = value.getChildByFieldName(FIELD_FUNCTION);
            if (isPresent(function) && IDENTIFIER.equals(function.getType())) {
                return source.text(function);
            }
            return null;
        }

        private List<String> baseNames(TSNode classNode) {
            TSNode superclasses = classNode.getChildByFieldName(FIELD_SUPERCLASSES);
            if (!isPresent(superclasses)) {
                return List.of();
            }
            List<String> bases = new ArrayList<>();
            int count = superclasses.getNamedChildCount();
            for (int i = 0; i < count; i++) {
                TSNode base = superclasses.getNamedChild(i);
                if (!isPresent(base)) {
                    continue;
                }
                // metaclass=..., **kwargs and comments are not bases
                String type = base.getType();
                if (IDENTIFIER.equals(type) || ATTRIBUTE.equals(type) || SUBSCRIPT.equals(type)) {
                    bases.add(simpleBaseName(compact(source.text(base))));
                }
            }
            return bases;
        }

        private List<String> parameterNames(TSNode parameters) {
            if (!isPresent(parameters)) {
                return List.of();
            }
            List<String> names = new ArrayList<>();
            int count = parameters.getNamedChildCount();
            for (int i = 0; i < count; i++) {
                TSNode parameter = parameters.getNamedChild(i);
                if (!isPresent(parameter)) {
                    continue;
                }
                String name = parameterName(parameter);
                if (name != null) {
                    names.add(name);
                }
            }
            return names;
        }

        private String parameterName(TSNode parameter) {
            return switch (parameter.getType()) {
                case IDENTIFIER -> source.text(parameter);
                case DEFAULT_PARAMETER, TYPED_DEFAULT_PARAMETER ->
                        source.text(parameter.getChildByFieldName(FIELD_NAME));
                case TYPED_PARAMETER, LIST_SPLAT_PATTERN, DICTIONARY_SPLAT_PATTERN -> {
                    TSNode inner = firstIdentifier(parameter);
                    yield inner == null ? null : source.text(inner);
                }
                default -> null;
            };
        }

        private TSNode firstIdentifier(TSNode node) {
            int count = node.getNamedChildCount();
            for (int i = 0; i < count; i++) {
                TSNode child = node.getNamedChild(i);
                if (!isPresent(child)) {
                    continue;
                }
                if (IDENTIFIER.equals(child.getType())) {
                    return child;
                }
                if (LIST_SPLAT_PATTERN.equals(child.getType()) || DICTIONARY_SPLAT_PATTERN.equals(child.getType())) {
                    return firstIdentifier(child);
                }
            }
            return null;
        }

        private boolean isAsync(TSNode function) {
            int count = function.getChildCount();
            for (int i = 0; i < count; i++) {
                TSNode child = function.getChild(i);
                if (isPresent(child) && ASYNC.equals(child.getType())) {
                    return true;
                }
            }
            return false;
        }

        private static int argumentCount(TSNode arguments) {
            if (!isPresent(arguments)) {
                return 0;
            }
            if (GENERATOR_EXPRESSION.equals(arguments.getType())) {
                return 1;
            }
            int count = 0;
            int named = arguments.getNamedChildCount();
            for (int i = 0; i < named; i++) {
                TSNode argument = arguments.getNamedChild(i);
                if (isPresent(argument) && !COMMENT.equals(argument.getType())) {
                    count++;
                }
            }
            return count;
        }

        private SourceLocation location(TSNode node) {
            return new SourceLocation(file, node.getStartPoint().getRow() + 1, node.getStartPoint().getColumn() + 1);
        }
    }

    /**
     * {@code abc.ABC} is matched as {@code ABC}, {@code Generic[T]} as {@code Generic}.
     */
    static String simpleBaseName(String base) {
        String name = base;
        int bracket = name.indexOf('[');
        if (bracket >= 0) {
            name = name.substring(0, bracket);
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    /**
     * Removes all whitespace, so that receivers split over several lines compare equal.
     */
    static String compact(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isPresent(TSNode node) {
        return node != null && !node.isNull();
    }
}
