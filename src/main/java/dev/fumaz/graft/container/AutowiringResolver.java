package dev.fumaz.graft.container;

import dev.fumaz.graft.context.ResolutionTracker;
import dev.fumaz.graft.exception.ConstructionException;
import dev.fumaz.graft.exception.NotFoundException;
import dev.fumaz.graft.exception.NotInstantiableException;
import dev.fumaz.graft.exception.NotInstantiableException.Reason;
import dev.fumaz.graft.introspect.TypeDescriptor;
import dev.fumaz.graft.introspect.TypeIntrospector;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.logging.Logger;

/**
 * Builds instances of concrete classes by resolving their constructor parameters.
 */
final class AutowiringResolver {

    private static final Logger LOGGER = Logger.getLogger(AutowiringResolver.class.getName());

    private final @NotNull GraftContainer container;
    private final @NotNull TypeIntrospector introspector;
    private final @NotNull ResolutionTracker tracker;
    private final @NotNull ParameterResolver parameters;

    AutowiringResolver(@NotNull GraftContainer container,
                       @NotNull TypeIntrospector introspector,
                       @NotNull ResolutionTracker tracker,
                       @NotNull ParameterResolver parameters) {
        this.container = container;
        this.introspector = introspector;
        this.tracker = tracker;
        this.parameters = parameters;
    }

    @Nullable Object resolve(@NotNull String id) {
        tracker.enter(id);

        try {
            TypeDescriptor descriptor = container.describe(id);

            if (descriptor == null) {
                throw new NotFoundException(id);
            }

            switch (descriptor.getKind()) {
                case CONCRETE:
                    break;
                case INTERFACE:
                    throw new NotInstantiableException(id, Reason.INTERFACE, tracker.chain());
                case ABSTRACT:
                    throw new NotInstantiableException(id, Reason.ABSTRACT, tracker.chain());
                case NO_ELIGIBLE_CONSTRUCTOR:
                    throw new NotInstantiableException(id, Reason.NO_ELIGIBLE_CONSTRUCTOR, tracker.chain());
                default:
                    throw new NotInstantiableException(id, Reason.UNSUPPORTED, tracker.chain());
            }

            LOGGER.finer(() -> "Autowiring " + id + " with " + descriptor.getParameters().size() + " parameter(s)");

            Object[] arguments = parameters.resolve("constructor of " + id, id, descriptor.getParameters());

            try {
                return introspector.construct(descriptor, arguments);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable throwable) {
                throw new ConstructionException(id, tracker.chain(), throwable);
            }
        } finally {
            tracker.exit(id);
        }
    }

}
