package io.github.koszti.querycorrelator.primary;

import io.github.koszti.querycorrelator.config.CorrelatorPrimaryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the statement id by calling a configured no-arg method on the driver's objects.
 * <p>
 * Drivers expose the server statement id through vendor interfaces (for example a
 * {@code getStatementId()} on their result set or statement), so the method is looked up on the
 * public interfaces of the runtime class first, then on the class itself. The result set is tried
 * before the statement.
 */
@Component
public class ReflectiveStatementIdResolver implements StatementIdResolver {

    private static final Logger log = LoggerFactory.getLogger(ReflectiveStatementIdResolver.class);

    private final String methodName;
    private final Map<Class<?>, Optional<Method>> methodsByType = new ConcurrentHashMap<>();

    @Autowired
    public ReflectiveStatementIdResolver(CorrelatorPrimaryProperties primaryProps) {
        this(primaryProps.getStatementIdMethod());
    }

    ReflectiveStatementIdResolver(String methodName) {
        this.methodName = Objects.requireNonNull(methodName, "methodName must not be null");
    }

    @Override
    public String resolve(Statement statement, ResultSet resultSet) {
        String id = invoke(resultSet);
        if (id == null) {
            id = invoke(statement);
        }
        return id;
    }

    private String invoke(Object target) {
        if (target == null) {
            return null;
        }
        Optional<Method> method = methodsByType.computeIfAbsent(target.getClass(), this::findAccessibleMethod);
        if (method.isEmpty()) {
            return null;
        }
        try {
            Object value = ReflectionUtils.invokeMethod(method.get(), target);
            if (value == null) {
                return null;
            }
            String id = value.toString();
            return id.isBlank() ? null : id;
        } catch (RuntimeException e) {
            log.debug("{}.{}() failed: {}", target.getClass().getName(), methodName, e.toString());
            return null;
        }
    }

    private Optional<Method> findAccessibleMethod(Class<?> type) {
        for (Class<?> iface : ClassUtils.getAllInterfacesForClassAsSet(type)) {
            if (!Modifier.isPublic(iface.getModifiers())) {
                continue;
            }
            Method m = ClassUtils.getMethodIfAvailable(iface, methodName);
            if (m != null) {
                return Optional.of(m);
            }
        }
        Method m = ClassUtils.getMethodIfAvailable(type, methodName);
        if (m != null && Modifier.isPublic(m.getDeclaringClass().getModifiers())) {
            return Optional.of(m);
        }
        log.debug("No public {}() on {}", methodName, type.getName());
        return Optional.empty();
    }
}
