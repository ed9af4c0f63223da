package org.tableaux.parser;

/**
 * Notazioni di output supportate da {@link FormulaPrinter}.
 */
public enum Notation {
    PREFIX,
    INFIX,
    POSTFIX;

    /**
     * Riconosce il nome di una notazione senza distinzione di maiuscole.
     *
     * @param name "prefix", "infix" o "postfix"
     * @return la notazione corrispondente
     * @throws IllegalArgumentException se il nome non è riconosciuto
     */
    public static Notation fromName(String name) {
        for (Notation notation : values()) {
            if (notation.name().equalsIgnoreCase(name)) {
                return notation;
            }
        }
        throw new IllegalArgumentException("Notazione sconosciuta: " + name + " (attese: prefix, infix, postfix)");
    }
}
