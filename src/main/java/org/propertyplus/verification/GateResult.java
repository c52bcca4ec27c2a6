package org.propertyplus.verification;

import lombok.Getter;

import java.util.Objects;

/**
 * Résultat typé d'une opération de vérification : une valeur, ou une erreur
 * ({@link GateError}) accompagnée d'un message optionnel destiné à l'utilisateur.
 * Le store ne renseigne jamais le message.
 */
@Getter
public final class GateResult<T> {

    private final T value;
    private final GateError error;
    private final String message;

    private GateResult(T value, GateError error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> GateResult<T> ok(T value) {
        return new GateResult<>(value, null, null);
    }

    public static GateResult<Void> ok() {
        return new GateResult<>(null, null, null);
    }

    public static <T> GateResult<T> fail(GateError error) {
        return fail(error, null);
    }

    public static <T> GateResult<T> fail(GateError error, String message) {
        return new GateResult<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isOk() {
        return error == null;
    }

    /** Même erreur, message remplacé. */
    public <U> GateResult<U> failWith(String newMessage) {
        if (isOk()) {
            throw new IllegalStateException("Cannot attach a failure message to a successful result");
        }
        return new GateResult<>(null, error, newMessage);
    }

    /** Propage un échec sous un autre type de valeur. */
    public <U> GateResult<U> propagate() {
        return failWith(message);
    }

    @Override
    public String toString() {
        return isOk() ? "GateResult[ok]" : "GateResult[" + error + (message != null ? ": " + message : "") + "]";
    }
}
