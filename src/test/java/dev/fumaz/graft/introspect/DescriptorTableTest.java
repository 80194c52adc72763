package dev.fumaz.graft.introspect;

import dev.fumaz.graft.container.Container;
import dev.fumaz.graft.container.ContainerOptions;
import dev.fumaz.graft.exception.NotInstantiableException;
import dev.fumaz.graft.exception.ParameterResolutionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DescriptorTableTest {

    @Test
    void describesRegisteredIdsThatNameNoClass() {
        DescriptorTable table = new DescriptorTable()
                .register(TypeDescriptor.builder("mailer")
                        .parameter(ParameterDescriptor.typed("host", String.class).withDefault("smtp.local"))
                        .instantiator(arguments -> "mailer@" + arguments[0])
                        .build());
        Container container = Container.create(ContainerOptions.builder().introspector(table).build());

        assertTrue(container.has("mailer"));
        assertEquals("mailer@smtp.local", container.get("mailer"));

        container.set("host", "smtp.example.org");

        assertEquals("mailer@smtp.example.org", container.get("mailer"));
    }

    @Test
    void fallsBackToReflection() {
        DescriptorTable table = DescriptorTable.withReflection();

        assertTrue(table.isKnownType(Plain.class.getName()));
        assertEquals(TypeKind.CONCRETE, table.describe(Plain.class.getName()).getKind());
        assertSame(Plain.class, table.findClass(Plain.class.getName()));
    }

    @Test
    void standaloneTableKnowsOnlyItsEntries() {
        DescriptorTable table = new DescriptorTable();

        assertFalse(table.isKnownType(Plain.class.getName()));
        assertNull(table.describe(Plain.class.getName()));
        assertNull(table.findClass(Plain.class.getName()));
    }

    @Test
    void untypedParameterUsesItsDefault() {
        DescriptorTable table = DescriptorTable.withReflection()
                .register(TypeDescriptor.builder("loose")
                        .parameter(ParameterDescriptor.untyped("something").withDefault("fallback"))
                        .instantiator(arguments -> arguments[0])
                        .build());
        Container container = Container.create(ContainerOptions.builder().introspector(table).build());

        assertEquals("fallback", container.get("loose"));
    }

    @Test
    void unionParameterIsRejected() {
        DescriptorTable table = DescriptorTable.withReflection()
                .register(TypeDescriptor.builder("needsUnion")
                        .parameter(ParameterDescriptor.union("target", Plain.class, Other.class))
                        .instantiator(arguments -> new Object())
                        .build());
        Container container = Container.create(ContainerOptions.builder().introspector(table).build());
        container.set(Plain.class);

        ParameterResolutionException exception = assertThrows(ParameterResolutionException.class,
                () -> container.get("needsUnion"));

        assertEquals("target", exception.getParameter());
        assertTrue(exception.getMessage().contains(Plain.class.getName() + "|" + Other.class.getName()));
    }

    @Test
    void unionParameterAcceptsAnOverride() {
        Invocable function = Invocable.function("pick")
                .parameter(ParameterDescriptor.union("target", Plain.class, Other.class))
                .body(arguments -> arguments[0]);
        Container container = Container.create();
        Plain plain = new Plain();

        assertSame(plain, container.invokeFunction(function, java.util.Map.of("target", plain)));
    }

    @Test
    void registeredInterfacesAreNotInstantiable() {
        DescriptorTable table = new DescriptorTable().registerInterface("Transport").registerAbstract("Channel");
        Container container = Container.create(ContainerOptions.builder().introspector(table).build());

        NotInstantiableException iface = assertThrows(NotInstantiableException.class,
                () -> container.get("Transport"));
        NotInstantiableException abstractType = assertThrows(NotInstantiableException.class,
                () -> container.get("Channel"));

        assertEquals(NotInstantiableException.Reason.INTERFACE, iface.getReason());
        assertEquals(NotInstantiableException.Reason.ABSTRACT, abstractType.getReason());
        assertFalse(container.has("Transport"));
    }

    @Test
    void singletonDescriptorsAreCached() {
        DescriptorTable table = new DescriptorTable()
                .register(TypeDescriptor.builder("clock")
                        .singleton(true)
                        .instantiator(arguments -> new Object())
                        .build());
        Container container = Container.create(ContainerOptions.builder().introspector(table).build());

        assertSame(container.get("clock"), container.get("clock"));
    }

    static class Plain {
    }

    static class Other {
    }

}
