package habitkit.spring.boot;

import habitkit.ExtensionBuilder;
import habitkit.ExtensionDescriptor;
import habitkit.ExtensionProvider;
import habitkit.registry.DefaultExtensionRegistry;
import habitkit.registry.ExtensionRegistry;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtensionRegistrarTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(RegistryConfig.class);

    @Test
    void registersAnnotatedProviders() {
        runner.withUserConfiguration(ProviderConfig.class).run(ctx -> {
            ExtensionRegistry registry = ctx.getBean(ExtensionRegistry.class);
            assertEquals(2, registry.size());
            assertTrue(registry.get("streak-tracker").isPresent());
            assertTrue(registry.get("mood-tracker").isPresent());
        });
    }

    @Test
    void registrationFollowsOrderAnnotation() {
        runner.withUserConfiguration(ProviderConfig.class).run(ctx -> {
            List<String> names = ctx.getBean(ExtensionRegistry.class).all().stream()
                    .map(ExtensionDescriptor::name)
                    .toList();
            assertEquals(List.of("mood-tracker", "streak-tracker"), names);
        });
    }

    @Test
    void descriptorBeansRegisterBeforeAnnotatedProviders() {
        runner.withUserConfiguration(ProviderConfig.class, DescriptorConfig.class).run(ctx -> {
            ExtensionRegistry registry = ctx.getBean(ExtensionRegistry.class);
            assertEquals(3, registry.size());
            assertEquals("plain", registry.all().get(0).name());
        });
    }

    @Test
    void duplicateNameFailsStartup() {
        runner.withUserConfiguration(ProviderConfig.class, DuplicateConfig.class).run(ctx -> {
            Throwable failure = ctx.getStartupFailure();
            assertNotNull(failure);
            BeanCreationException bce = findBeanCreationException(failure);
            assertTrue(bce.getMessage().contains("streak-tracker"), bce.getMessage());
        });
    }

    @Test
    void annotatedBeanMustImplementProvider() {
        runner.withUserConfiguration(NotAProviderConfig.class).run(ctx -> {
            Throwable failure = ctx.getStartupFailure();
            assertNotNull(failure);
            assertTrue(findBeanCreationException(failure).getMessage().contains("must implement ExtensionProvider"));
        });
    }

    @Test
    void invalidDescriptorFailsStartup() {
        runner.withUserConfiguration(BlankNameConfig.class).run(ctx -> {
            Throwable failure = ctx.getStartupFailure();
            assertNotNull(failure);
            assertInstanceOf(BeanCreationException.class, findBeanCreationException(failure));
        });
    }

    private static BeanCreationException findBeanCreationException(Throwable t) {
        Throwable current = t;
        while (current != null) {
            if (current instanceof BeanCreationException bce) {
                return bce;
            }
            current = current.getCause();
        }
        throw new AssertionError("No BeanCreationException in chain", t);
    }

    @Configuration
    static class RegistryConfig {
        @Bean
        DefaultExtensionRegistry extensionRegistry() {
            return new DefaultExtensionRegistry();
        }

        @Bean
        ExtensionRegistrar extensionRegistrar(ListableBeanFactory beanFactory, ExtensionRegistry registry) {
            return new ExtensionRegistrar(beanFactory, registry);
        }
    }

    @HabitExtension
    @Order(2)
    static class StreakProvider implements ExtensionProvider {
        @Override
        public ExtensionDescriptor descriptor() {
            return ExtensionBuilder.named("streak-tracker").forTypes("simple", "count").build();
        }
    }

    @HabitExtension
    @Order(1)
    static class MoodProvider implements ExtensionProvider {
        @Override
        public ExtensionDescriptor descriptor() {
            return ExtensionBuilder.named("mood-tracker").build();
        }
    }

    @Configuration
    static class ProviderConfig {
        @Bean
        StreakProvider streakProvider() {
            return new StreakProvider();
        }

        @Bean
        MoodProvider moodProvider() {
            return new MoodProvider();
        }
    }

    @Configuration
    static class DescriptorConfig {
        @Bean
        ExtensionDescriptor plainDescriptor() {
            return ExtensionBuilder.named("plain").build();
        }
    }

    @Configuration
    static class DuplicateConfig {
        @Bean
        ExtensionDescriptor anotherStreakTracker() {
            return ExtensionBuilder.named("streak-tracker").build();
        }
    }

    @HabitExtension
    static class NotAProvider {
    }

    @Configuration
    static class NotAProviderConfig {
        @Bean
        NotAProvider notAProvider() {
            return new NotAProvider();
        }
    }

    @HabitExtension
    static class BlankNameProvider implements ExtensionProvider {
        @Override
        public ExtensionDescriptor descriptor() {
            return new ExtensionDescriptor(" ", "1.0.0", null, null, null, null, null, null, null);
        }
    }

    @Configuration
    static class BlankNameConfig {
        @Bean
        BlankNameProvider blankNameProvider() {
            return new BlankNameProvider();
        }
    }
}
