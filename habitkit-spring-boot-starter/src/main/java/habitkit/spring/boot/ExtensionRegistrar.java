package habitkit.spring.boot;

import habitkit.ExtensionDescriptor;
import habitkit.ExtensionException;
import habitkit.ExtensionProvider;
import habitkit.registry.ExtensionRegistry;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Registers {@link ExtensionDescriptor} beans and {@link HabitExtension} beans in the
 * {@link ExtensionRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 * Registration errors become {@link BeanCreationException}s so a bad extension fails
 * startup instead of being silently skipped.
 *
 * @see HabitExtension
 */
public class ExtensionRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(ExtensionRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final ExtensionRegistry registry;

    public ExtensionRegistrar(ListableBeanFactory beanFactory, ExtensionRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, ExtensionDescriptor> descriptors = beanFactory.getBeansOfType(ExtensionDescriptor.class);
        for (String beanName : sortedNames(descriptors)) {
            register(beanName, descriptors.get(beanName));
        }

        Map<String, Object> annotated = beanFactory.getBeansWithAnnotation(HabitExtension.class);
        for (String beanName : sortedNames(annotated)) {
            Object bean = annotated.get(beanName);
            if (!(bean instanceof ExtensionProvider provider)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @HabitExtension must implement ExtensionProvider, " +
                                "but " + bean.getClass().getName() + " does not");
            }
            ExtensionDescriptor descriptor;
            try {
                descriptor = provider.descriptor();
            } catch (RuntimeException e) {
                throw new BeanCreationException(beanName, "Extension failed to build its descriptor", e);
            }
            register(beanName, descriptor);
        }
        logger.info("Registered " + registry.size() + " habit extension(s)");
    }

    private void register(String beanName, ExtensionDescriptor descriptor) {
        try {
            registry.register(descriptor);
        } catch (ExtensionException e) {
            throw new BeanCreationException(beanName, "Failed to register habit extension: " + e.getMessage(), e);
        }
    }

    private static <T> List<String> sortedNames(Map<String, T> beans) {
        List<Map.Entry<String, T>> entries = new ArrayList<>(beans.entrySet());
        entries.sort((a, b) -> AnnotationAwareOrderComparator.INSTANCE.compare(a.getValue(), b.getValue()));
        List<String> names = new ArrayList<>(entries.size());
        for (Map.Entry<String, T> entry : entries) {
            names.add(entry.getKey());
        }
        return names;
    }
}
