package de.bsommerfeld.updatecreator.cli.config;

import com.google.inject.AbstractModule;
import de.bsommerfeld.updatecreator.core.config.CreatorConfig;
import de.bsommerfeld.updatecreator.core.event.ApplicationEventBus;
import de.bsommerfeld.updatecreator.engine.place.Prompter;

/**
 * Guice module for a command-line run. The configuration and the prompter are created by
 * the entry point and bound as instances; engine components bind just in time.
 */
public class CreatorModule extends AbstractModule {

    private final CreatorConfig config;
    private final Prompter prompter;

    public CreatorModule(CreatorConfig config, Prompter prompter) {
        this.config = config;
        this.prompter = prompter;
    }

    @Override
    protected void configure() {
        bind(CreatorConfig.class).toInstance(config);
        bind(Prompter.class).toInstance(prompter);
        bind(ApplicationEventBus.class).asEagerSingleton();
    }
}
