package io.github.sachinnimbal.transferx.dto.field;

import org.springframework.core.ResolvableType;

import java.util.*;

/**
 * A resolved field type: the declared generic type of a field with its type
 * variables bound against the owning model. Answers the structural questions
 * the schema builder asks (union, tuple, collection, mapping).
 *
 * <p>Java has no union or tuple syntax, so they map as follows:
 * <ul>
 *   <li>union: {@link Optional} (value or nothing) and sealed interfaces/classes (permitted subtypes)</li>
 *   <li>fixed tuple: {@link Map.Entry}</li>
 *   <li>variadic tuple: arrays, handled like any other collection</li>
 * </ul>
 */
public final class FieldType {

    /** The {@code None} alternative of an optional union. */
    public static final FieldType NONE = new FieldType(ResolvableType.forClass(Void.class));
    public static final FieldType ANY = new FieldType(ResolvableType.forClass(Object.class));

    private final ResolvableType resolvableType;
    private final Class<?> rawClass;
    private volatile List<FieldType> innerTypes;

    private FieldType(ResolvableType resolvableType) {
        this.resolvableType = resolvableType;
        this.rawClass = resolvableType.resolve(Object.class);
    }

    public static FieldType of(ResolvableType resolvableType) {
        return new FieldType(resolvableType);
    }

    public static FieldType of(Class<?> type) {
        return new FieldType(ResolvableType.forClass(type));
    }

    public static FieldType forClassWithGenerics(Class<?> type, Class<?>... generics) {
        return new FieldType(ResolvableType.forClassWithGenerics(type, generics));
    }

    public ResolvableType getResolvableType() {
        return resolvableType;
    }

    public Class<?> getRawClass() {
        return rawClass;
    }

    public boolean isNone() {
        return rawClass == Void.class || rawClass == void.class;
    }

    public boolean isOptional() {
        return rawClass == Optional.class;
    }

    public boolean isSealedUnion() {
        return rawClass.isSealed() && !rawClass.isEnum() && !rawClass.getName().startsWith("java.");
    }

    public boolean isUnion() {
        return isOptional() || isSealedUnion();
    }

    public boolean isTuple() {
        return Map.Entry.class.isAssignableFrom(rawClass);
    }

    public boolean isArray() {
        return rawClass.isArray() && rawClass != byte[].class;
    }

    public boolean isCollection() {
        return isArray() || Collection.class.isAssignableFrom(rawClass);
    }

    public boolean isMapping() {
        return Map.class.isAssignableFrom(rawClass);
    }

    public boolean isSubclassOf(Class<?> type) {
        return type.isAssignableFrom(rawClass);
    }

    public boolean isPrimitive() {
        return rawClass.isPrimitive();
    }

    /**
     * Immediate inner types. Collections yield their element type, mappings
     * their key and value types, tuples their two positions, unions their
     * alternatives (with {@link #NONE} last for {@code Optional}).
     */
    public List<FieldType> getInnerTypes() {
        List<FieldType> result = innerTypes;
        if (result == null) {
            result = resolveInnerTypes();
            innerTypes = result;
        }
        return result;
    }

    public FieldType getInnerType(int index) {
        List<FieldType> inner = getInnerTypes();
        return index < inner.size() ? inner.get(index) : ANY;
    }

    private List<FieldType> resolveInnerTypes() {
        if (isOptional()) {
            return List.of(generic(resolvableType, 0), NONE);
        }
        if (isSealedUnion()) {
            List<FieldType> alternatives = new ArrayList<>();
            for (Class<?> permitted : rawClass.getPermittedSubclasses()) {
                alternatives.add(FieldType.of(permitted));
            }
            return List.copyOf(alternatives);
        }
        if (isArray()) {
            return List.of(new FieldType(resolvableType.getComponentType()));
        }
        if (Collection.class.isAssignableFrom(rawClass)) {
            return List.of(generic(resolvableType.asCollection(), 0));
        }
        if (isMapping()) {
            ResolvableType map = resolvableType.asMap();
            return List.of(generic(map, 0), generic(map, 1));
        }
        if (isTuple()) {
            ResolvableType entry = resolvableType.as(Map.Entry.class);
            return List.of(generic(entry, 0), generic(entry, 1));
        }
        ResolvableType[] generics = resolvableType.getGenerics();
        if (generics.length == 0) {
            return List.of();
        }
        List<FieldType> result = new ArrayList<>(generics.length);
        for (ResolvableType generic : generics) {
            result.add(new FieldType(generic));
        }
        return List.copyOf(result);
    }

    private static FieldType generic(ResolvableType type, int index) {
        ResolvableType generic = type.getGeneric(index);
        Class<?> resolved = generic.resolve();
        if (resolved == null || resolved == Object.class) {
            return ANY;
        }
        return new FieldType(generic);
    }

    /** Simple display name, e.g. {@code List<Person>}. */
    public String getDisplayName() {
        if (isArray()) {
            return getInnerType(0).getDisplayName() + "[]";
        }
        ResolvableType[] generics = resolvableType.getGenerics();
        if (generics.length == 0 || !resolvableType.hasGenerics()) {
            return rawClass.getSimpleName();
        }
        StringJoiner joiner = new StringJoiner(", ", rawClass.getSimpleName() + "<", ">");
        for (ResolvableType generic : generics) {
            joiner.add(new FieldType(generic).getDisplayName());
        }
        return joiner.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldType other)) return false;
        return resolvableType.equals(other.resolvableType);
    }

    @Override
    public int hashCode() {
        return resolvableType.hashCode();
    }

    @Override
    public String toString() {
        return resolvableType.toString();
    }
}
