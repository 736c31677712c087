package io.verbatim.syntax.api;

import static java.lang.annotation.ElementType.*;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks plumbing that grammar and rule modules share with the core but that is not part of the
 * supported API: the parser event buffer, the green tree builder and similar.
 *
 * <p>Grammars in this repository may use {@code @Internal} types; external grammars should go
 * through {@link io.verbatim.syntax.parser.Parser} and {@link SyntaxNode} instead, as internals
 * change without notice.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({TYPE, METHOD, FIELD, PACKAGE})
public @interface Internal {
  /**
   * Optional explanation of what public API should be used instead.
   *
   * @return description of the internal API and alternatives
   */
  String value() default "";
}
