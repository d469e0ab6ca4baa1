// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.junit;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.lang.reflect.Parameter;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.hiero.correlator.CapturedEvents;
import org.hiero.correlator.CorrelatedLogging;
import org.hiero.correlator.CorrelationScope;
import org.hiero.correlator.CorrelationToken;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ExtensionContext.Namespace;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;

/**
 * JUnit extension that runs every test method inside its own correlation scope.
 *
 * <p>Before each test the capture path is initialized and a scope is opened on the thread that executes the test.
 * The scope is closed after the test. A test method can declare parameters of type {@link CorrelationToken},
 * {@link CorrelationScope} and {@link CapturedEventsSupplier} to access the scope and the events it captured.
 */
public class CorrelationExtension implements BeforeEachCallback, AfterEachCallback, ParameterResolver {

    /**
     * The namespace of the extension.
     */
    private static final Namespace EXTENSION_NAMESPACE = Namespace.create(CorrelationExtension.class);

    /**
     * The key to store the scope in the extension context.
     */
    private static final String SCOPE_KEY = "scope";

    private static final Set<Class<?>> SUPPORTED_TYPES =
            Set.of(CorrelationToken.class, CorrelationScope.class, CapturedEventsSupplier.class);

    /**
     * Initializes the capture path and opens the scope of the test.
     *
     * @param extensionContext the extension context of the test
     */
    @Override
    public void beforeEach(@NonNull final ExtensionContext extensionContext) {
        Objects.requireNonNull(extensionContext, "extensionContext must not be null");
        CorrelatedLogging.initialize();
        extensionContext.getStore(EXTENSION_NAMESPACE).put(SCOPE_KEY, CorrelatedLogging.beginScope());
    }

    /**
     * Closes the scope of the test.
     *
     * @param extensionContext the extension context of the test
     */
    @Override
    public void afterEach(@NonNull final ExtensionContext extensionContext) {
        Objects.requireNonNull(extensionContext, "extensionContext must not be null");
        final CorrelationScope scope =
                extensionContext.getStore(EXTENSION_NAMESPACE).remove(SCOPE_KEY, CorrelationScope.class);
        if (scope != null) {
            scope.close();
        }
    }

    /**
     * Checks if this extension supports parameter resolution for the given parameter context.
     *
     * @param parameterContext the context of the parameter to be resolved
     * @param ignored the extension context of the test (ignored)
     *
     * @return true if parameter resolution is supported, false otherwise
     *
     * @throws ParameterResolutionException if an error occurs during parameter resolution
     */
    @Override
    public boolean supportsParameter(
            @NonNull final ParameterContext parameterContext, @Nullable final ExtensionContext ignored)
            throws ParameterResolutionException {
        Objects.requireNonNull(parameterContext, "parameterContext must not be null");

        return Optional.of(parameterContext)
                .map(ParameterContext::getParameter)
                .map(Parameter::getType)
                .filter(SUPPORTED_TYPES::contains)
                .isPresent();
    }

    /**
     * Resolves a parameter of a test method from the scope of the test.
     *
     * @param parameterContext the context of the parameter to be resolved
     * @param extensionContext the extension context of the test
     *
     * @return the resolved parameter value
     *
     * @throws ParameterResolutionException if the parameter is not supported or no scope is open
     */
    @Override
    public Object resolveParameter(
            @NonNull final ParameterContext parameterContext, @NonNull final ExtensionContext extensionContext)
            throws ParameterResolutionException {
        Objects.requireNonNull(parameterContext, "parameterContext must not be null");
        Objects.requireNonNull(extensionContext, "extensionContext must not be null");

        final CorrelationScope scope =
                extensionContext.getStore(EXTENSION_NAMESPACE).get(SCOPE_KEY, CorrelationScope.class);
        if (scope == null) {
            throw new ParameterResolutionException(
                    "No correlation scope is open, parameters can only be resolved for test methods");
        }

        final Class<?> type = parameterContext.getParameter().getType();
        if (type.equals(CorrelationToken.class)) {
            return scope.token();
        }
        if (type.equals(CorrelationScope.class)) {
            return scope;
        }
        if (type.equals(CapturedEventsSupplier.class)) {
            return new TokenEventsSupplier(scope.token());
        }
        throw new ParameterResolutionException("Could not resolve parameter of type " + type.getName());
    }

    /**
     * Queries the global store for a fixed token.
     *
     * @param token the token of the test
     */
    private record TokenEventsSupplier(@NonNull CorrelationToken token) implements CapturedEventsSupplier {

        @Override
        @NonNull
        public CapturedEvents get() {
            return CorrelatedLogging.eventsFor(token);
        }
    }
}
