package com.acme.wiring.micronaut;

import com.acme.wiring.consumer.ConsumeScope;
import com.acme.wiring.core.RegistrationResolutionException;
import io.micronaut.context.BeanContext;
import io.micronaut.context.exceptions.BeanContextException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/** Message scope whose consumer instances are created by, and destroyed through, the bean context. */
@Slf4j
class BeanContextConsumeScope implements ConsumeScope {
    private final BeanContext beanContext;
    private final List<Object> created = new ArrayList<>();

    BeanContextConsumeScope(BeanContext beanContext) {
        this.beanContext = beanContext;
    }

    @Override
    public <T> T getInstance(Class<T> type) {
        try {
            T instance = beanContext.createBean(type);
            created.add(instance);
            return instance;
        } catch (BeanContextException e) {
            throw new RegistrationResolutionException("Unable to create consumer " + type.getName(), e);
        }
    }

    @Override
    public void close() {
        for (int i = created.size() - 1; i >= 0; i--) {
            Object bean = created.get(i);
            try {
                beanContext.destroyBean(bean);
            } catch (RuntimeException e) {
                log.warn("Failed to destroy consumer {}", bean.getClass().getSimpleName(), e);
            }
        }
        created.clear();
    }
}
