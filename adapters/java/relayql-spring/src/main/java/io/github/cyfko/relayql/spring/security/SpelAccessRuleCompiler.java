package io.github.cyfko.relayql.spring.security;

import io.github.cyfko.relayql.core.config.ResolverConfig;
import io.github.cyfko.relayql.core.exception.AccessDeniedException;
import io.github.cyfko.relayql.core.exception.ResourceDefinitionException;
import io.github.cyfko.relayql.core.security.AccessRule;
import io.github.cyfko.relayql.core.security.Principal;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.SpelNode;
import org.springframework.expression.spel.ast.PropertyOrFieldReference;
import org.springframework.expression.spel.standard.SpelExpression;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Compiles Spring Expression Language access expressions into {@link AccessRule}s.
 *
 * <h2>Examples</h2>
 * <pre>{@code
 * compiler.compile("isAuthenticated()");
 * compiler.compile("hasRole('ROLE_ADMIN') or object['owner'] == user.name");
 * }</pre>
 *
 * <p>
 * An expression that references {@code object} reads the subject and yields a rule evaluated per item
 * ({@link AccessRule#requiresSubject()}). Expressions are parsed once at compile time and evaluated in a
 * read-only context: type references, constructors and assignments are not available. An expression
 * that fails to evaluate denies access with an {@link AccessDeniedException}.
 * </p>
 *
 * @see AccessExpressionRoot
 */
public class SpelAccessRuleCompiler {
    private static final Logger logger = Logger.getLogger(SpelAccessRuleCompiler.class.getName());

    static final String SUBJECT_VARIABLE = "object";

    private final SpelExpressionParser parser = new SpelExpressionParser();

    /**
     * @param expression boolean SpEL expression
     * @return the compiled rule
     * @throws ResourceDefinitionException if the expression cannot be parsed
     */
    public AccessRule compile(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ResourceDefinitionException("Access expression cannot be blank");
        }
        SpelExpression parsed;
        try {
            parsed = parser.parseRaw(expression);
        } catch (ParseException e) {
            throw new ResourceDefinitionException("Invalid access expression '" + expression + "': " + e.getMessage(), e);
        }
        boolean requiresSubject = references(parsed.getAST(), SUBJECT_VARIABLE);
        logger.fine(() -> String.format("Compiled access expression '%s' (subject rule: %s)", expression, requiresSubject));
        return new ExpressionRule(expression, parsed, requiresSubject);
    }

    private static boolean references(SpelNode node, String name) {
        if (node instanceof PropertyOrFieldReference reference && reference.getName().equals(name)) {
            return true;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            if (references(node.getChild(i), name)) {
                return true;
            }
        }
        return false;
    }

    private record ExpressionRule(String source, SpelExpression expression, boolean requiresSubject) implements AccessRule {

        @Override
        public boolean test(Principal principal, Map<String, Object> subject) {
            EvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding()
                    .withInstanceMethods()
                    .withRootObject(new AccessExpressionRoot(principal, subject))
                    .build();
            try {
                return Boolean.TRUE.equals(expression.getValue(context, Boolean.class));
            } catch (EvaluationException e) {
                logger.warning(() -> String.format("Cannot evaluate access expression '%s': %s", source, e.getMessage()));
                throw new AccessDeniedException(ResolverConfig.DEFAULT_DENIAL_MESSAGE, e);
            }
        }

        @Override
        public String toString() {
            return source;
        }
    }
}
