package io.cflow.model;

/**
 * A call expression inside a definition body.
 *
 * @param calleeText    Source text of the callee expression with whitespace removed
 * @param form          Shape of the callee expression
 * @param name          Called name for {@link CallForm#BARE}, method name for {@link CallForm#ATTRIBUTE}
 * @param receiver      Receiver text for {@link CallForm#ATTRIBUTE} (e.g. {@code self.repo}), null otherwise
 * @param argumentCount Number of arguments, keyword arguments included
 * @param location      Position of the call expression
 * @param offset        End byte of the call expression, which orders nested calls innermost first
 */
public record CallSite(
        String calleeText,
        CallForm form,
        String name,
        String receiver,
        int argumentCount,
        SourceLocation location,
        int offset
) implements BodyEvent {
    public CallSite {
        if (form == null) {
            throw new IllegalArgumentException("Call form cannot be null");
        }
        if (form != CallForm.OTHER && (name == null || name.isBlank())) {
            throw new IllegalArgumentException(form + " call requires a name: " + calleeText);
        }
        if (form == CallForm.ATTRIBUTE && (receiver == null || receiver.isBlank())) {
            throw new IllegalArgumentException("Attribute call requires a receiver: " + calleeText);
        }
        if (argumentCount < 0) {
            throw new IllegalArgumentException("Argument count cannot be negative: " + argumentCount);
        }
    }

    public static CallSite bare(String name, int argumentCount, SourceLocation location, int offset) {
        return new CallSite(name, CallForm.BARE, name, null, argumentCount, location, offset);
    }

    public static CallSite attribute(String receiver, String method, int argumentCount,
                                     SourceLocation location, int offset) {
        return new CallSite(receiver + "." + method, CallForm.ATTRIBUTE, method, receiver,
                argumentCount, location, offset);
    }

    public static CallSite other(String calleeText, int argumentCount, SourceLocation location, int offset) {
        return new CallSite(calleeText, CallForm.OTHER, null, null, argumentCount, location, offset);
    }
}
