package com.bazaarvoice.ability.condition.eval;

import com.google.common.base.CaseFormat;
import com.google.common.base.Throwables;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.UncheckedExecutionException;

import javax.annotation.Nullable;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public abstract class AttributeReaders {

    private static final AttributeReader DOCUMENTS = new DocumentAttributeReader();
    private static final AttributeReader BEANS = new BeanAttributeReader();

    /**
     * Reads attributes of JSON-style documents.  Maps are read by key, a missing key reads as {@code null}.  Any
     * other value, including {@code null}, lists and scalars, has no attributes and reads {@code null} for every name.
     */
    public static AttributeReader documents() {
        return DOCUMENTS;
    }

    /**
     * Reads attributes of Java objects.  Maps are read by key.  Other objects are read through a public no-argument
     * method named {@code getName()}, {@code isName()} or {@code name()}, or else a public field {@code name}.
     * Underscored names are also tried in lower camel case, so {@code owner_id} finds {@code getOwnerId()}.
     * <p>
     * An object with no such accessor raises {@link MissingAttributeException}, as does reading any attribute of
     * {@code null}.  Exceptions thrown by the accessor itself propagate unchanged.
     */
    public static AttributeReader beans() {
        return BEANS;
    }

    private static class DocumentAttributeReader implements AttributeReader {
        @Nullable
        @Override
        public Object read(@Nullable Object target, String name) {
            return (target instanceof Map) ? ((Map<?, ?>) target).get(name) : null;
        }
    }

    private static class BeanAttributeReader implements AttributeReader {
        private final LoadingCache<Map.Entry<Class<?>, String>, Optional<Accessor>> _accessors = CacheBuilder.newBuilder()
                .maximumSize(10000)
                .build(new CacheLoader<Map.Entry<Class<?>, String>, Optional<Accessor>>() {
                    @Override
                    public Optional<Accessor> load(Map.Entry<Class<?>, String> key) {
                        return findAccessor(key.getKey(), key.getValue());
                    }
                });

        @Nullable
        @Override
        public Object read(@Nullable Object target, String name) {
            if (target instanceof Map) {
                return ((Map<?, ?>) target).get(name);
            }
            if (target == null) {
                throw new MissingAttributeException(null, name);
            }
            Optional<Accessor> accessor;
            try {
                accessor = _accessors.getUnchecked(Maps.<Class<?>, String>immutableEntry(target.getClass(), name));
            } catch (UncheckedExecutionException e) {
                Throwables.throwIfUnchecked(e.getCause());
                throw e;
            }
            if (!accessor.isPresent()) {
                throw new MissingAttributeException(target.getClass(), name);
            }
            return accessor.get().get(target);
        }
    }

    private static Optional<Accessor> findAccessor(Class<?> type, String name) {
        Set<String> names = new LinkedHashSet<>();
        names.add(name);
        if (name.indexOf('_') >= 0) {
            names.add(CaseFormat.LOWER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name));
        }
        for (String candidate : names) {
            String capitalized = Character.toUpperCase(candidate.charAt(0)) + candidate.substring(1);
            for (String methodName : new String[] {"get" + capitalized, "is" + capitalized, candidate}) {
                Method method = findMethod(type, methodName);
                if (method != null) {
                    return Optional.of(new MethodAccessor(method));
                }
            }
        }
        for (String candidate : names) {
            Field field = findField(type, candidate);
            if (field != null) {
                return Optional.of(new FieldAccessor(field));
            }
        }
        return Optional.empty();
    }

    @Nullable
    private static Method findMethod(Class<?> type, String name) {
        try {
            Method method = type.getMethod(name);
            if (method.getReturnType() == void.class || Modifier.isStatic(method.getModifiers()) ||
                    method.getDeclaringClass() == Object.class) {
                return null;
            }
            // Public methods of non-public classes, such as lambdas or nested classes, still need this.
            method.trySetAccessible();
            return method;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    @Nullable
    private static Field findField(Class<?> type, String name) {
        try {
            Field field = type.getField(name);
            if (Modifier.isStatic(field.getModifiers())) {
                return null;
            }
            field.trySetAccessible();
            return field;
        } catch (NoSuchFieldException e) {
            return null;
        }
    }

    private interface Accessor {
        Object get(Object target);
    }

    private static class MethodAccessor implements Accessor {
        private final Method _method;

        MethodAccessor(Method method) {
            _method = method;
        }

        @Override
        public Object get(Object target) {
            try {
                return _method.invoke(target);
            } catch (InvocationTargetException e) {
                // The object's own failure, pass it along as-is.
                Throwables.throwIfUnchecked(e.getCause());
                throw new RuntimeException(e.getCause());
            } catch (IllegalAccessException e) {
                throw new IllegalStateException(e);
            }
        }
    }

    private static class FieldAccessor implements Accessor {
        private final Field _field;

        FieldAccessor(Field field) {
            _field = field;
        }

        @Override
        public Object get(Object target) {
            try {
                return _field.get(target);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException(e);
            }
        }
    }
}
