package io.github.cyfko.relayql.jpa.utils;

import io.github.cyfko.relayql.jpa.exception.EntityMappingException;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Locale;

/**
 * Reflection utility methods for reading and writing entity properties by name.
 *
 * <p>
 * Properties are accessed through their JavaBeans accessor when one exists ({@code getX}/{@code isX},
 * {@code setX}), and through the declared field otherwise. Fields are looked up along the class
 * hierarchy so mapped superclasses are supported.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ReflectionUtils {

    private ReflectionUtils() {
        throw new UnsupportedOperationException("ReflectionUtils is a utility class and cannot be instantiated");
    }

    /**
     * Reads a property value.
     *
     * @param bean     target object
     * @param property property name
     * @return the property value
     * @throws EntityMappingException if the property does not exist or cannot be read
     */
    public static Object readProperty(Object bean, String property) {
        Class<?> type = bean.getClass();
        Method getter = findGetter(type, property);
        try {
            if (getter != null) {
                return getter.invoke(bean);
            }
            Field field = findField(type, property);
            field.setAccessible(true);
            return field.get(bean);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new EntityMappingException("Cannot read property '" + property + "' of " + type.getSimpleName(), e);
        }
    }

    /**
     * Writes a property value.
     *
     * @param bean     target object
     * @param property property name
     * @param value    new value, already converted to {@link #propertyType}
     * @throws EntityMappingException if the property does not exist or cannot be written
     */
    public static void writeProperty(Object bean, String property, Object value) {
        Class<?> type = bean.getClass();
        Method setter = findSetter(type, property, propertyType(type, property));
        try {
            if (setter != null) {
                setter.invoke(bean, value);
                return;
            }
            Field field = findField(type, property);
            field.setAccessible(true);
            field.set(bean, value);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new EntityMappingException("Cannot write property '" + property + "' of " + type.getSimpleName(), e);
        }
    }

    /**
     * @return the declared type of a property
     * @throws EntityMappingException if the property does not exist
     */
    public static Class<?> propertyType(Class<?> type, String property) {
        Method getter = findGetter(type, property);
        return getter != null ? getter.getReturnType() : findField(type, property).getType();
    }

    /**
     * Instantiates a class through its no-argument constructor, which may be non-public.
     *
     * @throws EntityMappingException if the class cannot be instantiated
     */
    public static <T> T instantiate(Class<T> type) {
        try {
            Constructor<T> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new EntityMappingException("Cannot instantiate " + type.getName(), e);
        }
    }

    private static Method findGetter(Class<?> type, String property) {
        String suffix = capitalize(property);
        for (Method method : type.getMethods()) {
            boolean named = method.getName().equals("get" + suffix) || method.getName().equals("is" + suffix);
            if (named && method.getParameterCount() == 0 && method.getReturnType() != void.class) {
                return method;
            }
        }
        return null;
    }

    private static Method findSetter(Class<?> type, String property, Class<?> propertyType) {
        String name = "set" + capitalize(property);
        for (Method method : type.getMethods()) {
            if (method.getName().equals(name) && method.getParameterCount() == 1
                    && method.getParameterTypes()[0].equals(propertyType)) {
                return method;
            }
        }
        return null;
    }

    private static Field findField(Class<?> type, String property) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(property)) {
                    return field;
                }
            }
        }
        throw new EntityMappingException("No property '" + property + "' on " + type.getName());
    }

    private static String capitalize(String property) {
        return property.substring(0, 1).toUpperCase(Locale.ROOT) + property.substring(1);
    }
}
