package com.invoicedesk.backend.validation;

/**
 * Liga o nome do campo no formulário à propriedade do objeto de formulário.
 *
 * @param name           nome enviado pelo cliente e usado como chave dos erros
 * @param property       propriedade Java que recebe o valor
 * @param invalidMessage mensagem usada quando o valor não pode ser convertido para o tipo da propriedade
 */
public record FormField(String name, String property, String invalidMessage) {

    public static FormField of(String name, String invalidMessage) {
        return new FormField(name, name, invalidMessage);
    }
}
