package com.invoicedesk.backend.services.mutations;

import java.util.Objects;

import com.invoicedesk.backend.dto.FormState;

import lombok.Getter;

/**
 * Desfecho de uma mutação.
 *
 * <ul>
 *   <li>{@link Kind#REDIRECT}: escrita concluída e view invalidada; o chamador deve navegar para {@link #getTarget()}.</li>
 *   <li>{@link Kind#SUCCESS}: escrita concluída, sem navegação (exclusões).</li>
 *   <li>{@link Kind#FAILURE}: nada foi gravado; {@link #getState()} traz mensagem e, se houver, erros por campo.</li>
 *   <li>{@link Kind#REJECTED}: a regra de negócio barrou a operação; nada foi gravado.</li>
 * </ul>
 */
@Getter
public final class MutationOutcome {

    public enum Kind {
        REDIRECT,
        SUCCESS,
        FAILURE,
        REJECTED
    }

    private final Kind kind;
    private final String target;
    private final FormState state;

    private MutationOutcome(Kind kind, String target, FormState state) {
        this.kind = kind;
        this.target = target;
        this.state = state;
    }

    public static MutationOutcome redirect(String target) {
        return new MutationOutcome(Kind.REDIRECT, Objects.requireNonNull(target, "target"), null);
    }

    public static MutationOutcome success(String message) {
        return new MutationOutcome(Kind.SUCCESS, null, FormState.message(message));
    }

    public static MutationOutcome failure(FormState state) {
        return new MutationOutcome(Kind.FAILURE, null, Objects.requireNonNull(state, "state"));
    }

    public static MutationOutcome failure(String message) {
        return failure(FormState.message(message));
    }

    public static MutationOutcome rejected(String message) {
        return new MutationOutcome(Kind.REJECTED, null, FormState.message(message));
    }

    public boolean isRedirect() {
        return kind == Kind.REDIRECT;
    }

    public String getMessage() {
        return state != null ? state.getMessage() : null;
    }

    @Override
    public String toString() {
        return "MutationOutcome{" + kind + (target != null ? " -> " + target : "") + (state != null ? ", " + state : "") + "}";
    }
}
