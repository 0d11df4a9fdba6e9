package com.e2eq.relations.morphia;

import dev.morphia.Datastore;
import io.quarkus.logging.Log;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

@ApplicationScoped
public class RelationsDatastoreInstaller {

    @Inject
    TouchInterceptor touchInterceptor;

    @Inject
    @Any
    Instance<Datastore> datastores;

    void onStart(@Observes StartupEvent ev) {
        int count = 0;
        for (Datastore datastore : datastores) {
            touchInterceptor.installOn(datastore);
            count++;
        }
        if (count == 0) {
            Log.warn("No Morphia Datastore bean found, call TouchInterceptor.installOn for datastores created by hand");
        }
    }
}
