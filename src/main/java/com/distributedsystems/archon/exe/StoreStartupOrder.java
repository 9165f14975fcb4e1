package com.distributedsystems.archon.exe;

import com.distributedsystems.archon.persistence.StoreFileGuard;
import org.springframework.boot.autoconfigure.orm.jpa.EntityManagerFactoryDependsOnPostProcessor;
import org.springframework.context.annotation.Configuration;

/**
 * The entity manager factory opens the first store connection, so it waits for the store file.
 */
@Configuration(proxyBeanMethods = false)
public class StoreStartupOrder extends EntityManagerFactoryDependsOnPostProcessor {

    public StoreStartupOrder() {
        super(StoreFileGuard.class);
    }
}
