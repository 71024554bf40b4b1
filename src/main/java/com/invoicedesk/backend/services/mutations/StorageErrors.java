package com.invoicedesk.backend.services.mutations;

final class StorageErrors {

    private StorageErrors() {
    }

    /**
     * "Database Error: Failed to Create Invoice. {causa}". A causa fica vazia quando a exceção não tem mensagem.
     */
    static String describe(String failedAction, RuntimeException e) {
        String cause = e.getMessage() != null ? e.getMessage() : "";
        return "Database Error: Failed to " + failedAction + ". " + cause;
    }
}
