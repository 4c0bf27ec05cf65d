package io.fanout.spring.boot;

import io.fanout.Channel;
import io.fanout.registry.DefaultChannelRegistry;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link NotificationChannel} and registers them in the
 * {@link DefaultChannelRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see NotificationChannel
 */
public class NotificationChannelRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultChannelRegistry registry;

    public NotificationChannelRegistrar(ListableBeanFactory beanFactory, DefaultChannelRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(NotificationChannel.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof Channel channel)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @NotificationChannel must implement Channel, "
                                + "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation on the target class
            NotificationChannel annotation = AnnotationUtils.findAnnotation(bean.getClass(), NotificationChannel.class);
            if (annotation == null) {
                annotation = beanFactory.findAnnotationOnBean(beanName, NotificationChannel.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @NotificationChannel annotation on " + bean.getClass().getName());
            }
            if (annotation.value().isEmpty()) {
                throw new BeanCreationException(beanName, "@NotificationChannel must specify a channel name");
            }

            registry.register(annotation.value(), channel);
        }
    }
}
