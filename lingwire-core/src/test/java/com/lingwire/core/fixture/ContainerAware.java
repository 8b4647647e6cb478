package com.lingwire.core.fixture;

import com.lingwire.api.container.ServiceContainer;

public class ContainerAware {

    private final ServiceContainer container;

    public ContainerAware(ServiceContainer container) {
        this.container = container;
    }

    public ServiceContainer getContainer() {
        return container;
    }
}
