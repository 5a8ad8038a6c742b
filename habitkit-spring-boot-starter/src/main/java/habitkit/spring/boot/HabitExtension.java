package habitkit.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a habit extension.
 *
 * <p>The annotated bean must implement {@link habitkit.ExtensionProvider}. Its descriptor
 * is registered once all singletons exist; a descriptor that fails validation or
 * duplicates another extension's name aborts context startup.
 *
 * <pre>{@code
 * @Component
 * @HabitExtension
 * public class StreakTracker implements ExtensionProvider {
 *   public ExtensionDescriptor descriptor() { ... }
 * }
 * }</pre>
 *
 * <p>Extensions register, and therefore merge, in {@link org.springframework.core.annotation.Order}
 * order. Plain {@link habitkit.ExtensionDescriptor} beans are registered as well and
 * come first.
 *
 * @see ExtensionRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface HabitExtension {
}
