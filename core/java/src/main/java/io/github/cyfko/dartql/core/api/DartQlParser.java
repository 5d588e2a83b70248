package io.github.cyfko.dartql.core.api;

import io.github.cyfko.dartql.core.model.LexerResult;
import io.github.cyfko.dartql.core.model.ParseResult;

/**
 * Parser for DartQL, the WHERE-clause dialect used to filter task records.
 *
 * <h2>Grammar</h2>
 * <table border="1">
 * <caption>DartQL Operator Reference</caption>
 * <thead>
 * <tr><th>Construct</th><th>Syntax</th><th>Precedence</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Highest</td><td>(status = 'Todo' OR status = 'Doing')</td></tr>
 * <tr><td>Comparison</td><td>= != &gt; &gt;= &lt; &lt;= LIKE CONTAINS, [NOT] IN, IS [NOT] NULL, BETWEEN</td><td>4</td><td>priority BETWEEN 2 AND 5</td></tr>
 * <tr><td>NOT</td><td>NOT</td><td>3</td><td>NOT assignee IS NULL</td></tr>
 * <tr><td>AND</td><td>AND</td><td>2</td><td>status = 'Todo' AND tags CONTAINS 'urgent'</td></tr>
 * <tr><td>OR</td><td>OR</td><td>1</td><td>size = 1 OR size = 2</td></tr>
 * </tbody>
 * </table>
 * <p>
 * Keywords are case-insensitive; field names are matched case-insensitively against the configured
 * vocabulary. Strings use single or double quotes, numbers are unsigned decimals.
 * </p>
 *
 * <h2>Error Detection</h2>
 * <p>
 * Implementations never throw for malformed query text. Every problem is reported as a displayable message
 * carrying the offending position:
 * </p>
 * <ul>
 *   <li>{@code Unknown field: 'priorty'. Did you mean 'priority'? (at position 0)}</li>
 *   <li>{@code Expected value (string, number, or NULL), got end of input at position 8}</li>
 *   <li>{@code Empty query}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface DartQlParser {

    /**
     * Parses {@code query} into an expression tree.
     *
     * @param query the query text, {@code null} being treated as empty
     * @return the tree and its diagnostics; the tree is {@link Group#empty()} whenever a production failed
     */
    ParseResult parse(String query);

    /**
     * Tokenizes and validates {@code query} without building a tree.
     *
     * @param query the query text, {@code null} being treated as empty
     * @return the tokens, referenced fields and validation errors
     */
    LexerResult lex(String query);
}
