package org.duplex.host.gateway;

import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.EnumValueDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Message;

import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Sets protobuf request fields from HTTP path and query parameters.
 *
 * <p>Parameter names address fields by proto name or JSON name; dotted names walk into nested
 * singular message fields ({@code filter.name}). Parameters naming no field are ignored. Only scalar,
 * enum and bytes fields can be set; bytes are base64 encoded.</p>
 */
final class MessageFieldBinder {

    private MessageFieldBinder() {
    }

    static void bindAll(final Message.Builder builder, final Map<String, List<String>> parameters) {
        for (final Map.Entry<String, List<String>> entry : parameters.entrySet()) {
            for (final String value : entry.getValue()) {
                bind(builder, entry.getKey(), value);
            }
        }
    }

    static void bindEach(final Message.Builder builder, final Map<String, String> parameters) {
        for (final Map.Entry<String, String> entry : parameters.entrySet()) {
            bind(builder, entry.getKey(), entry.getValue());
        }
    }

    /**
     * @throws IllegalArgumentException if the value cannot be converted to the field's type.
     */
    static void bind(final Message.Builder root, final String path, final String value) {
        final String[] segments = path.split("\\.");
        Message.Builder builder = root;
        for (int i = 0; i < segments.length - 1; i++) {
            final FieldDescriptor field = findField(builder.getDescriptorForType(), segments[i]);
            if (field == null) {
                return;
            }
            if (field.getJavaType() != FieldDescriptor.JavaType.MESSAGE || field.isRepeated()) {
                throw new IllegalArgumentException("Parameter '" + path + "' does not address a nested message field");
            }
            builder = builder.getFieldBuilder(field);
        }

        final FieldDescriptor field = findField(builder.getDescriptorForType(), segments[segments.length - 1]);
        if (field == null) {
            return;
        }
        final Object converted = convert(field, path, value);
        if (field.isRepeated()) {
            builder.addRepeatedField(field, converted);
        } else {
            builder.setField(field, converted);
        }
    }

    private static FieldDescriptor findField(final Descriptor descriptor, final String name) {
        final FieldDescriptor byName = descriptor.findFieldByName(name);
        if (byName != null) {
            return byName;
        }
        for (final FieldDescriptor field : descriptor.getFields()) {
            if (field.getJsonName().equals(name)) {
                return field;
            }
        }
        return null;
    }

    private static Object convert(final FieldDescriptor field, final String path, final String value) {
        try {
            switch (field.getJavaType()) {
                case STRING:
                    return value;
                case INT:
                    return Integer.parseInt(value);
                case LONG:
                    return Long.parseLong(value);
                case FLOAT:
                    return Float.parseFloat(value);
                case DOUBLE:
                    return Double.parseDouble(value);
                case BOOLEAN:
                    if ("true".equalsIgnoreCase(value)) {
                        return Boolean.TRUE;
                    }
                    if ("false".equalsIgnoreCase(value)) {
                        return Boolean.FALSE;
                    }
                    throw new IllegalArgumentException("Parameter '" + path + "' is not a boolean: " + value);
                case BYTE_STRING:
                    return ByteString.copyFrom(Base64.getDecoder().decode(value));
                case ENUM:
                    return enumValue(field, path, value);
                case MESSAGE:
                default:
                    throw new IllegalArgumentException("Parameter '" + path + "' addresses a message field");
            }
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + path + "' is not a valid " + field.getJavaType() + ": " + value, e);
        }
    }

    private static EnumValueDescriptor enumValue(final FieldDescriptor field, final String path, final String value) {
        EnumValueDescriptor enumValue = field.getEnumType().findValueByName(value);
        if (enumValue == null && value.matches("-?\\d{1,9}")) {
            enumValue = field.getEnumType().findValueByNumber(Integer.parseInt(value));
        }
        if (enumValue == null) {
            throw new IllegalArgumentException("Parameter '" + path + "' is not a value of " + field.getEnumType().getName() + ": " + value);
        }
        return enumValue;
    }
}
