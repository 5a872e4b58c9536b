package io.pockethive.phased.context;

import java.beans.PropertyDescriptor;
import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import org.springframework.beans.BeanUtils;
import org.springframework.util.ReflectionUtils;

/**
 * Dotted variable lookup: {@code user.address.city}, {@code items.0}, {@code order.total}.
 * <p>
 * Each step reads a map key, a list/array index or a bean property (JavaBean getter or record
 * accessor). Any missing step raises {@link UnknownVariableException} for the whole path.
 */
public final class VariablePaths {

    private VariablePaths() {
    }

    public static String root(String path) {
        int dot = path.indexOf('.');
        return dot < 0 ? path : path.substring(0, dot);
    }

    static Object resolve(RenderContext context, String path) {
        if (context.containsKey(path)) {
            return context.get(path);
        }
        String[] segments = path.split("\\.", -1);
        if (segments.length < 2 || !context.containsKey(segments[0])) {
            throw new UnknownVariableException(path);
        }
        Object current = context.get(segments[0]);
        for (int i = 1; i < segments.length; i++) {
            current = step(current, segments[i], path);
        }
        return current;
    }

    private static Object step(Object target, String segment, String path) {
        if (target == null || segment.isEmpty()) {
            throw new UnknownVariableException(path);
        }
        if (target instanceof Map<?, ?> map) {
            if (map.containsKey(segment)) {
                return map.get(segment);
            }
            throw new UnknownVariableException(path);
        }
        if (isIndex(segment)) {
            int index = Integer.parseInt(segment);
            if (target instanceof List<?> list && index < list.size()) {
                return list.get(index);
            }
            if (target.getClass().isArray() && index < Array.getLength(target)) {
                return Array.get(target, index);
            }
            throw new UnknownVariableException(path);
        }
        Method reader = findReader(target.getClass(), segment);
        if (reader == null) {
            throw new UnknownVariableException(path);
        }
        ReflectionUtils.makeAccessible(reader);
        return ReflectionUtils.invokeMethod(reader, target);
    }

    private static Method findReader(Class<?> type, String property) {
        if ("class".equals(property)) {
            return null;
        }
        PropertyDescriptor descriptor = BeanUtils.getPropertyDescriptor(type, property);
        if (descriptor != null && descriptor.getReadMethod() != null) {
            return descriptor.getReadMethod();
        }
        // record components and other plain accessors
        Method accessor = ReflectionUtils.findMethod(type, property);
        if (accessor == null || accessor.getReturnType() == void.class) {
            return null;
        }
        return accessor;
    }

    private static boolean isIndex(String segment) {
        if (segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
