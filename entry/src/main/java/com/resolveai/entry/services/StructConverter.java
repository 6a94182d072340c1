package com.resolveai.entry.services;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.resolveai.entry.exceptions.CircularReferenceException;

import java.io.IOException;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts plain Java maps and beans to the wire structured-value form, and structs back to maps.
 *
 * <p>A struct is written as {@code {"fields": {name: value}}} where each value is an object holding exactly one of
 * {@code nullValue}, {@code numberValue}, {@code stringValue}, {@code boolValue}, {@code blobValue},
 * {@code structValue} or {@code listValue}. Scalars the format has no kind for are written as their string form.
 */
public class StructConverter {

    public static final String CIRCULAR_MARKER = "[Circular]";

    private final ObjectMapper objectMapper;

    public StructConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Encodes a map, or the properties of a bean, as a struct. Beans are read one level at a time so a cycle through a
     * bean is caught like any other.
     */
    public ObjectNode toStruct(Object source, boolean removeCircular) {
        Set<Object> path = Collections.newSetFromMap(new IdentityHashMap<>());
        path.add(source);
        if (source instanceof Map) {
            return encodeStruct((Map<?, ?>) source, removeCircular, path, "");
        }
        return encodeStruct(readProperties(source), removeCircular, path, "");
    }

    public Map<String, Object> toMap(JsonNode struct) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (struct == null || struct.isNull()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = struct.path("fields").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.put(field.getKey(), decodeValue(field.getValue()));
        }
        return result;
    }

    private ObjectNode encodeStruct(Map<?, ?> map, boolean removeCircular, Set<Object> path, String location) {
        ObjectNode struct = objectMapper.createObjectNode();
        ObjectNode fields = struct.putObject("fields");
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String name = String.valueOf(entry.getKey());
            fields.set(name, encodeValue(entry.getValue(), removeCircular, path, location + "." + name));
        }
        return struct;
    }

    private ObjectNode encodeValue(Object value, boolean removeCircular, Set<Object> path, String location) {
        ObjectNode encoded = objectMapper.createObjectNode();
        if (value == null) {
            encoded.put("nullValue", "NULL_VALUE");
        } else if (value instanceof Boolean) {
            encoded.put("boolValue", (Boolean) value);
        } else if (value instanceof Number) {
            putNumber(encoded, (Number) value);
        } else if (value instanceof CharSequence || value instanceof Character || value instanceof Enum) {
            encoded.put("stringValue", value.toString());
        } else if (value instanceof byte[]) {
            encoded.put("blobValue", (byte[]) value);
        } else if (value instanceof Map || value instanceof Collection || value.getClass().isArray()
                || isBean(value)) {
            if (!path.add(value)) {
                if (!removeCircular) {
                    throw new CircularReferenceException(location.isEmpty() ? "." : location);
                }
                encoded.put("stringValue", CIRCULAR_MARKER);
                return encoded;
            }
            try {
                if (value instanceof Map) {
                    encoded.set("structValue", encodeStruct((Map<?, ?>) value, removeCircular, path, location));
                } else if (isBean(value)) {
                    encoded.set("structValue", encodeStruct(readProperties(value), removeCircular, path, location));
                } else {
                    encoded.set("listValue", encodeList(value, removeCircular, path, location));
                }
            } finally {
                path.remove(value);
            }
        } else {
            encoded.put("stringValue", value.toString());
        }
        return encoded;
    }

    private ObjectNode encodeList(Object sequence, boolean removeCircular, Set<Object> path, String location) {
        ObjectNode list = objectMapper.createObjectNode();
        ArrayNode values = list.putArray("values");
        int index = 0;
        if (sequence instanceof Collection) {
            for (Object item : (Collection<?>) sequence) {
                values.add(encodeValue(item, removeCircular, path, location + "[" + index++ + "]"));
            }
        } else {
            int length = Array.getLength(sequence);
            for (; index < length; index++) {
                values.add(encodeValue(Array.get(sequence, index), removeCircular, path, location + "[" + index + "]"));
            }
        }
        return list;
    }

    private void putNumber(ObjectNode encoded, Number number) {
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            encoded.put("numberValue", number.intValue());
        } else if (number instanceof Long) {
            encoded.put("numberValue", number.longValue());
        } else if (number instanceof BigInteger) {
            encoded.put("numberValue", (BigInteger) number);
        } else if (number instanceof BigDecimal) {
            encoded.put("numberValue", (BigDecimal) number);
        } else {
            encoded.put("numberValue", number.doubleValue());
        }
    }

    /**
     * Reads the serializable properties of a bean as Jackson sees them, without following their values.
     */
    private Map<String, Object> readProperties(Object bean) {
        JavaType type = objectMapper.constructType(bean.getClass());
        BeanDescription description = objectMapper.getSerializationConfig().introspect(type);
        Map<String, Object> properties = new LinkedHashMap<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            AnnotatedMember accessor = property.getAccessor();
            if (accessor == null) {
                continue;
            }
            accessor.fixAccess(false);
            properties.put(property.getName(), accessor.getValue(bean));
        }
        return properties;
    }

    private boolean isBean(Object value) {
        String packageName = value.getClass().getPackageName();
        return !packageName.startsWith("java.") && !packageName.startsWith("javax.");
    }

    private Object decodeValue(JsonNode value) {
        if (value.has("structValue")) {
            return toMap(value.get("structValue"));
        }
        if (value.has("listValue")) {
            List<Object> items = new ArrayList<>();
            for (JsonNode item : value.get("listValue").path("values")) {
                items.add(decodeValue(item));
            }
            return items;
        }
        if (value.has("stringValue")) {
            return value.get("stringValue").asText();
        }
        if (value.has("numberValue")) {
            return value.get("numberValue").numberValue();
        }
        if (value.has("boolValue")) {
            return value.get("boolValue").asBoolean();
        }
        if (value.has("blobValue")) {
            try {
                return value.get("blobValue").binaryValue();
            } catch (IOException e) {
                throw new IllegalArgumentException("Invalid blobValue in structured payload", e);
            }
        }
        return null;
    }
}
