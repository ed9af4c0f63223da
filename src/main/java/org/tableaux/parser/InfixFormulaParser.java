package org.tableaux.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.tableaux.formula.Formula;
import org.tableaux.formula.SymbolCatalog;
import org.tableaux.formula.SymbolKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER INFISSO - Da stringa in notazione infissa ad albero {@link Formula}
 *
 * Il testo viene scomposto in token dal lexer ANTLR {@code FormulaLexer}; la conversione
 * e la costruzione dell'albero sono fatte qui, in due fasi.
 *
 * FASE 1 - INFISSO -&gt; POSTFISSO:
 * • Parentesi aperta: push sullo stack operatori
 * • Parentesi chiusa: pop degli operatori in output fino alla parentesi aperta dello stesso stile
 * • Proposizione: direttamente in output
 * • Connettivo: push sullo stack operatori, SENZA confronto di precedenza
 * • Fine input: gli operatori rimasti passano in output in ordine di pop
 *
 * Tutti i connettivi hanno la stessa precedenza: il raggruppamento è deciso solo dalle
 * parentesi esplicite, altrimenti l'ultimo operatore inserito è il primo applicato.
 * Ad esempio "A &amp; B | C" equivale a "A &amp; (B | C)" e "~A &amp; B" a "~(A &amp; B)".
 *
 * FASE 2 - POSTFISSO -&gt; ALBERO:
 * • Proposizione: push di una foglia
 * • Negazione: pop di un operando
 * • Connettivo binario: pop di due operandi (il secondo estratto è il figlio sinistro)
 * • Lo stack finale deve contenere esattamente un albero
 *
 * CASI DI FALLIMENTO (mai eccezioni, sempre {@link ParseResult#failure}):
 * • Carattere non riconosciuto
 * • Parentesi non bilanciate o di stile diverso
 * • Operandi insufficienti per un operatore
 * • Numero di alberi residui diverso da uno
 *
 * Nessuna fase è ricorsiva: la profondità di annidamento è limitata solo dalla memoria.
 *
 * @version 1.0.0
 */
public final class InfixFormulaParser {

    private static final Logger LOGGER = Logger.getLogger(InfixFormulaParser.class.getName());

    private InfixFormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PUNTO DI INGRESSO

    /**
     * Analizza una formula in notazione infissa.
     *
     * @param text formula da analizzare (spazi ignorati, maiuscole significative)
     * @return esito con l'albero prodotto o il motivo del fallimento
     */
    public static ParseResult parse(String text) {
        if (text == null) {
            return ParseResult.failure("Formula null");
        }

        PostfixConversion conversion = convertToPostfix(text);
        if (conversion.errorMessage != null) {
            LOGGER.fine(() -> "Formula rifiutata: '" + text + "' - " + conversion.errorMessage);
            return ParseResult.failure(conversion.errorMessage);
        }

        ParseResult result = buildTree(conversion.postfix);
        if (result.isSuccess()) {
            LOGGER.fine(() -> "Formula accettata: '" + text + "' -> " + result.requireFormula());
        } else {
            LOGGER.fine(() -> "Formula rifiutata: '" + text + "' - " + result.getErrorMessage());
        }
        return result;
    }

    /**
     * Espone la sequenza postfissa intermedia prodotta dalla fase 1.
     *
     * @param text formula in notazione infissa
     * @return testi dei token in ordine postfisso, lista vuota se la conversione fallisce
     */
    public static List<String> toPostfix(String text) {
        if (text == null) {
            return List.of();
        }
        PostfixConversion conversion = convertToPostfix(text);
        if (conversion.errorMessage != null) {
            return List.of();
        }

        List<String> symbols = new ArrayList<>();
        for (Lexeme lexeme : conversion.postfix) {
            symbols.add(lexeme.text);
        }
        return Collections.unmodifiableList(symbols);
    }

    //endregion

    //region FASE 0: TOKENIZZAZIONE ANTLR

    /**
     * Scompone il testo con il lexer generato; gli spazi sono scartati dalla grammatica.
     */
    private static List<Lexeme> tokenize(String text, RecordingErrorListener errors) {
        FormulaLexer lexer = new FormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        List<Lexeme> lexemes = new ArrayList<>();
        for (Token token : lexer.getAllTokens()) {
            lexemes.add(new Lexeme(kindOf(token), token.getText()));
        }
        return lexemes;
    }

    private static SymbolKind kindOf(Token token) {
        return switch (token.getType()) {
            case FormulaLexer.PROPOSITION -> SymbolKind.PROPOSITION;
            case FormulaLexer.NEGATION -> SymbolKind.NEGATION;
            case FormulaLexer.CONJUNCTION -> SymbolKind.CONJUNCTION;
            case FormulaLexer.DISJUNCTION -> SymbolKind.DISJUNCTION;
            case FormulaLexer.IMPLICATION -> SymbolKind.IMPLICATION;
            case FormulaLexer.LEFT_PAREN -> SymbolKind.LEFT_PAREN;
            case FormulaLexer.RIGHT_PAREN -> SymbolKind.RIGHT_PAREN;
            default -> SymbolKind.UNKNOWN;
        };
    }

    //endregion

    //region FASE 1: INFISSO -> POSTFISSO

    private static PostfixConversion convertToPostfix(String text) {
        RecordingErrorListener errors = new RecordingErrorListener();
        List<Lexeme> lexemes = tokenize(text, errors);
        if (errors.firstError != null) {
            return PostfixConversion.failed(errors.firstError);
        }

        Deque<Lexeme> operatorStack = new ArrayDeque<>();
        List<Lexeme> output = new ArrayList<>();

        for (Lexeme lexeme : lexemes) {
            switch (lexeme.kind) {
                case LEFT_PAREN -> operatorStack.push(lexeme);

                case RIGHT_PAREN -> {
                    while (!operatorStack.isEmpty() && operatorStack.peek().kind != SymbolKind.LEFT_PAREN) {
                        output.add(operatorStack.pop());
                    }
                    if (operatorStack.isEmpty()) {
                        return PostfixConversion.failed("Parentesi chiusa '" + lexeme.text + "' senza apertura");
                    }
                    String expectedOpening = SymbolCatalog.mirror(lexeme.text).orElse("");
                    Lexeme opening = operatorStack.pop();
                    if (!opening.text.equals(expectedOpening)) {
                        return PostfixConversion.failed(String.format(
                                "Parentesi '%s' chiusa da '%s' di stile diverso", opening.text, lexeme.text));
                    }
                }

                case PROPOSITION -> output.add(lexeme);

                // Nessuna precedenza tra connettivi: sempre push
                case NEGATION, CONJUNCTION, DISJUNCTION, IMPLICATION -> operatorStack.push(lexeme);

                default -> {
                    return PostfixConversion.failed("Simbolo non riconosciuto: '" + lexeme.text + "'");
                }
            }
        }

        while (!operatorStack.isEmpty()) {
            Lexeme remaining = operatorStack.pop();
            if (remaining.kind == SymbolKind.LEFT_PAREN) {
                return PostfixConversion.failed("Parentesi aperta '" + remaining.text + "' non chiusa");
            }
            output.add(remaining);
        }

        return PostfixConversion.succeeded(output);
    }

    //endregion

    //region FASE 2: POSTFISSO -> ALBERO

    private static ParseResult buildTree(List<Lexeme> postfix) {
        Deque<Formula> operands = new ArrayDeque<>();

        for (Lexeme lexeme : postfix) {
            SymbolKind kind = lexeme.kind;

            if (kind == SymbolKind.PROPOSITION) {
                operands.push(Formula.proposition(lexeme.text));
            } else if (kind == SymbolKind.NEGATION) {
                if (operands.isEmpty()) {
                    return ParseResult.failure("Operando mancante per la negazione '" + lexeme.text + "'");
                }
                operands.push(Formula.negation(operands.pop()));
            } else if (kind.isBinary()) {
                if (operands.size() < 2) {
                    return ParseResult.failure("Operandi insufficienti per il connettivo '" + lexeme.text + "'");
                }
                // Ordine inverso: il primo estratto è il figlio destro
                Formula right = operands.pop();
                Formula left = operands.pop();
                operands.push(Formula.of(kind, left, right));
            } else {
                return ParseResult.failure("Simbolo inatteso nella sequenza postfissa: '" + lexeme.text + "'");
            }
        }

        if (operands.size() != 1) {
            return ParseResult.failure("La formula deve produrre un solo albero, trovati " + operands.size());
        }
        return ParseResult.success(operands.pop());
    }

    //endregion

    //region CLASSI DI SUPPORTO

    /**
     * Token con il tipo del catalogo e il testo originale.
     */
    private static final class Lexeme {
        final SymbolKind kind;
        final String text;

        Lexeme(SymbolKind kind, String text) {
            this.kind = kind;
            this.text = text;
        }
    }

    /**
     * Esito della fase 1: sequenza postfissa o messaggio d'errore.
     */
    private static final class PostfixConversion {
        final List<Lexeme> postfix;
        final String errorMessage;

        private PostfixConversion(List<Lexeme> postfix, String errorMessage) {
            this.postfix = postfix;
            this.errorMessage = errorMessage;
        }

        static PostfixConversion succeeded(List<Lexeme> postfix) {
            return new PostfixConversion(postfix, null);
        }

        static PostfixConversion failed(String errorMessage) {
            return new PostfixConversion(List.of(), errorMessage);
        }
    }

    /**
     * Registra il primo errore del lexer al posto della stampa su console di ANTLR.
     */
    private static final class RecordingErrorListener extends BaseErrorListener {
        String firstError;

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            if (firstError == null) {
                firstError = "Carattere non riconosciuto in posizione " + charPositionInLine + ": " + msg;
            }
        }
    }

    //endregion
}
