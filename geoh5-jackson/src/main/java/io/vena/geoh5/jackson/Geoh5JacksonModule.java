package io.vena.geoh5.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.jsontype.TypeDeserializer;
import com.fasterxml.jackson.databind.jsontype.TypeSerializer;
import com.fasterxml.jackson.databind.ser.Serializers;
import com.fasterxml.jackson.databind.type.MapType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import io.vena.geoh5.EntityKind;
import io.vena.geoh5.OctreeCell;
import io.vena.geoh5.store.AttributeMap;
import io.vena.geoh5.store.EntityRecord;
import io.vena.geoh5.store.TypeRecord;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;

import static com.fasterxml.jackson.core.JsonToken.END_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.END_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.START_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.START_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.VALUE_NULL;

/**
 * Jackson support for the records a {@link io.vena.geoh5.store.ContainerStore} exchanges.
 *
 * <ul>
 *     <li>{@link AttributeMap}: a JSON object, in insertion order</li>
 *     <li>{@link OctreeCell}: an array <code>[i, j, k, nCells]</code></li>
 *     <li>{@link TypeRecord} and {@link EntityRecord}: JSON objects; null fields are omitted</li>
 *     <li>{@link ContainerDocument}: a JSON object with one field per section</li>
 * </ul>
 */
public final class Geoh5JacksonModule extends Module {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new ContainerSerializers());
		context.addDeserializers(new ContainerDeserializers());
	}

	private static final class ContainerSerializers extends Serializers.Base {
		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (AttributeMap.class.isAssignableFrom(theClass)) {
				return ATTRIBUTE_MAP_SERIALIZER;
			} else if (OctreeCell.class.isAssignableFrom(theClass)) {
				return OCTREE_CELL_SERIALIZER;
			} else if (TypeRecord.class.isAssignableFrom(theClass)) {
				return TYPE_RECORD_SERIALIZER;
			} else if (EntityRecord.class.isAssignableFrom(theClass)) {
				return ENTITY_RECORD_SERIALIZER;
			} else if (ContainerDocument.class.isAssignableFrom(theClass)) {
				return DOCUMENT_SERIALIZER;
			} else {
				return null;
			}
		}

		/**
		 * {@link AttributeMap} is a {@link Map}, so Jackson asks here first.
		 */
		@Override
		public JsonSerializer<?> findMapSerializer(SerializationConfig config, MapType type, BeanDescription beanDesc, JsonSerializer<Object> keySerializer, TypeSerializer elementTypeSerializer, JsonSerializer<Object> elementValueSerializer) {
			return findSerializer(config, type, beanDesc);
		}
	}

	private static final class ContainerDeserializers extends Deserializers.Base {
		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (AttributeMap.class.isAssignableFrom(theClass)) {
				return ATTRIBUTE_MAP_DESERIALIZER;
			} else if (OctreeCell.class.isAssignableFrom(theClass)) {
				return OCTREE_CELL_DESERIALIZER;
			} else if (TypeRecord.class.isAssignableFrom(theClass)) {
				return TYPE_RECORD_DESERIALIZER;
			} else if (EntityRecord.class.isAssignableFrom(theClass)) {
				return ENTITY_RECORD_DESERIALIZER;
			} else if (ContainerDocument.class.isAssignableFrom(theClass)) {
				return DOCUMENT_DESERIALIZER;
			} else {
				return null;
			}
		}

		@Override
		public JsonDeserializer<?> findMapDeserializer(MapType type, DeserializationConfig config, BeanDescription beanDesc, KeyDeserializer keyDeserializer, TypeDeserializer elementTypeDeserializer, JsonDeserializer<?> elementDeserializer) {
			return findBeanDeserializer(type, config, beanDesc);
		}
	}

	///////////////////////
	//
	//  AttributeMap
	//

	private static final JsonSerializer<AttributeMap> ATTRIBUTE_MAP_SERIALIZER = new JsonSerializer<AttributeMap>() {
		@Override
		public void serialize(AttributeMap value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeStartObject();
			for (Map.Entry<String, Object> entry: value.entrySet()) {
				gen.writeFieldName(entry.getKey());
				serializers.defaultSerializeValue(entry.getValue(), gen);
			}
			gen.writeEndObject();
		}
	};

	/**
	 * Values are read as Jackson's untyped objects; {@link AttributeMap}'s
	 * typed accessors turn the resulting lists back into arrays.
	 */
	private static final JsonDeserializer<AttributeMap> ATTRIBUTE_MAP_DESERIALIZER = new Geoh5Deserializer<AttributeMap>() {
		@Override
		public AttributeMap deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
			LinkedHashMap<String, Object> entries = new LinkedHashMap<>();
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				String key = p.currentName();
				p.nextToken();
				Object value = ctxt.readValue(p, Object.class);
				if (value == null) {
					continue;
				}
				if (entries.put(key, value) != null) {
					throw new JsonParseException(p, "Attribute appears twice: \"" + key + "\"");
				}
			}
			return AttributeMap.fromOrderedMap(entries);
		}
	};

	///////////////////////
	//
	//  OctreeCell
	//

	private static final JsonSerializer<OctreeCell> OCTREE_CELL_SERIALIZER = new JsonSerializer<OctreeCell>() {
		@Override
		public void serialize(OctreeCell value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeStartArray();
			gen.writeNumber(value.i());
			gen.writeNumber(value.j());
			gen.writeNumber(value.k());
			gen.writeNumber(value.nCells());
			gen.writeEndArray();
		}
	};

	private static final JsonDeserializer<OctreeCell> OCTREE_CELL_DESERIALIZER = new Geoh5Deserializer<OctreeCell>() {
		@Override
		public OctreeCell deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
			expect(START_ARRAY, p);
			int[] values = new int[4];
			for (int n = 0; n < values.length; n++) {
				if (p.nextToken() != JsonToken.VALUE_NUMBER_INT) {
					throw new JsonParseException(p, "Octree cell must be four integers");
				}
				values[n] = p.getIntValue();
			}
			p.nextToken();
			expect(END_ARRAY, p);
			try {
				return new OctreeCell(values[0], values[1], values[2], values[3]);
			} catch (IllegalArgumentException e) {
				throw new JsonParseException(p, e.getMessage(), e);
			}
		}
	};

	///////////////////////
	//
	//  Records
	//

	private static final JsonSerializer<TypeRecord> TYPE_RECORD_SERIALIZER = new JsonSerializer<TypeRecord>() {
		@Override
		public void serialize(TypeRecord value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeStartObject();
			gen.writeStringField(UID, value.uid().toString());
			gen.writeStringField(KIND, value.kind().name());
			writeOptionalField(gen, CLASS_ID, value.classId());
			writeOptionalField(gen, NAME, value.name());
			writeOptionalField(gen, DESCRIPTION, value.description());
			gen.writeFieldName(ATTRIBUTES);
			ATTRIBUTE_MAP_SERIALIZER.serialize(value.attributes(), gen, serializers);
			gen.writeEndObject();
		}
	};

	private static final JsonDeserializer<TypeRecord> TYPE_RECORD_DESERIALIZER = new Geoh5Deserializer<TypeRecord>() {
		@Override
		public TypeRecord deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
			UUID uid = null;
			EntityKind kind = null;
			UUID classId = null;
			String name = null;
			String description = null;
			AttributeMap attributes = AttributeMap.empty();
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				String field = p.currentName();
				p.nextToken();
				switch (field) {
					case UID: uid = readUuid(p); break;
					case KIND: kind = readKind(p); break;
					case CLASS_ID: classId = readUuid(p); break;
					case NAME: name = readText(p); break;
					case DESCRIPTION: description = readText(p); break;
					case ATTRIBUTES: attributes = ATTRIBUTE_MAP_DESERIALIZER.deserialize(p, ctxt); break;
					default: throw new JsonParseException(p, "Unexpected field in type: \"" + field + "\"");
				}
			}
			return new TypeRecord(required(uid, UID, p), required(kind, KIND, p), classId, name, description, attributes);
		}
	};

	private static final JsonSerializer<EntityRecord> ENTITY_RECORD_SERIALIZER = new JsonSerializer<EntityRecord>() {
		@Override
		public void serialize(EntityRecord value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeStartObject();
			gen.writeStringField(UID, value.uid().toString());
			gen.writeStringField(KIND, value.kind().name());
			gen.writeStringField(TYPE, value.typeUid().toString());
			writeOptionalField(gen, PARENT, value.parentUid());
			gen.writeStringField(NAME, value.name());
			gen.writeFieldName(ATTRIBUTES);
			ATTRIBUTE_MAP_SERIALIZER.serialize(value.attributes(), gen, serializers);
			gen.writeEndObject();
		}
	};

	private static final JsonDeserializer<EntityRecord> ENTITY_RECORD_DESERIALIZER = new Geoh5Deserializer<EntityRecord>() {
		@Override
		public EntityRecord deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
			UUID uid = null;
			EntityKind kind = null;
			UUID typeUid = null;
			UUID parentUid = null;
			String name = null;
			AttributeMap attributes = AttributeMap.empty();
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				String field = p.currentName();
				p.nextToken();
				switch (field) {
					case UID: uid = readUuid(p); break;
					case KIND: kind = readKind(p); break;
					case TYPE: typeUid = readUuid(p); break;
					case PARENT: parentUid = readUuid(p); break;
					case NAME: name = readText(p); break;
					case ATTRIBUTES: attributes = ATTRIBUTE_MAP_DESERIALIZER.deserialize(p, ctxt); break;
					default: throw new JsonParseException(p, "Unexpected field in entity: \"" + field + "\"");
				}
			}
			return new EntityRecord(required(uid, UID, p), required(kind, KIND, p), required(typeUid, TYPE, p), parentUid, required(name, NAME, p), attributes);
		}
	};

	///////////////////////
	//
	//  Document
	//

	private static final JsonSerializer<ContainerDocument> DOCUMENT_SERIALIZER = new JsonSerializer<ContainerDocument>() {
		@Override
		public void serialize(ContainerDocument value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeStartObject();
			gen.writeFieldName(WORKSPACE);
			ATTRIBUTE_MAP_SERIALIZER.serialize(value.workspace(), gen, serializers);
			gen.writeFieldName(TYPES);
			gen.writeStartArray();
			for (TypeRecord type: value.types()) {
				TYPE_RECORD_SERIALIZER.serialize(type, gen, serializers);
			}
			gen.writeEndArray();
			gen.writeFieldName(ENTITIES);
			gen.writeStartArray();
			for (EntityRecord entity: value.entities()) {
				ENTITY_RECORD_SERIALIZER.serialize(entity, gen, serializers);
			}
			gen.writeEndArray();
			gen.writeFieldName(OCTREE_CELLS);
			gen.writeStartObject();
			for (Map.Entry<UUID, List<OctreeCell>> entry: value.octreeCells().entrySet()) {
				gen.writeFieldName(entry.getKey().toString());
				gen.writeStartArray();
				for (OctreeCell cell: entry.getValue()) {
					OCTREE_CELL_SERIALIZER.serialize(cell, gen, serializers);
				}
				gen.writeEndArray();
			}
			gen.writeEndObject();
			gen.writeEndObject();
		}
	};

	private static final JsonDeserializer<ContainerDocument> DOCUMENT_DESERIALIZER = new Geoh5Deserializer<ContainerDocument>() {
		@Override
		@SuppressWarnings("unchecked")
		public ContainerDocument deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
			AttributeMap workspace = AttributeMap.empty();
			List<TypeRecord> types = null;
			List<EntityRecord> entities = null;
			Map<UUID, List<OctreeCell>> cells = new LinkedHashMap<>();
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				String field = p.currentName();
				p.nextToken();
				switch (field) {
					case WORKSPACE:
						workspace = ATTRIBUTE_MAP_DESERIALIZER.deserialize(p, ctxt);
						break;
					case TYPES:
						types = (List<TypeRecord>) ctxt.findContextualValueDeserializer(TYPE_LIST_TYPE, null).deserialize(p, ctxt);
						break;
					case ENTITIES:
						entities = (List<EntityRecord>) ctxt.findContextualValueDeserializer(ENTITY_LIST_TYPE, null).deserialize(p, ctxt);
						break;
					case OCTREE_CELLS:
						cells = (Map<UUID, List<OctreeCell>>) ctxt.findContextualValueDeserializer(CELL_MAP_TYPE, null).deserialize(p, ctxt);
						break;
					default:
						throw new JsonParseException(p, "Unexpected field in container: \"" + field + "\"");
				}
			}
			return new ContainerDocument(workspace, required(types, TYPES, p), required(entities, ENTITIES, p), cells);
		}
	};

	///////////////////////
	//
	//  Helpers
	//

	/**
	 * Common properties all our deserializers have.
	 */
	private abstract static class Geoh5Deserializer<T> extends JsonDeserializer<T> {
		@Override public boolean isCachable() { return true; }
	}

	private static void writeOptionalField(JsonGenerator gen, String field, @Nullable Object value) throws IOException {
		if (value != null) {
			gen.writeStringField(field, value.toString());
		}
	}

	private static @Nullable String readText(JsonParser p) throws IOException {
		if (p.currentToken() == VALUE_NULL) {
			return null;
		}
		return p.getValueAsString();
	}

	private static @Nullable UUID readUuid(JsonParser p) throws IOException {
		String text = readText(p);
		if (text == null) {
			return null;
		}
		try {
			return UUID.fromString(text);
		} catch (IllegalArgumentException e) {
			throw new JsonParseException(p, "Invalid uid: \"" + text + "\"", e);
		}
	}

	private static EntityKind readKind(JsonParser p) throws IOException {
		String text = readText(p);
		try {
			return EntityKind.valueOf(String.valueOf(text));
		} catch (IllegalArgumentException e) {
			throw new JsonParseException(p, "Invalid entity kind: \"" + text + "\"", e);
		}
	}

	private static <T> T required(@Nullable T value, String field, JsonParser p) throws JsonParseException {
		if (value == null) {
			throw new JsonParseException(p, "Missing field \"" + field + "\"");
		}
		return value;
	}

	public static void expect(JsonToken expected, JsonParser p) throws IOException {
		if (p.currentToken() != expected) {
			throw new JsonParseException(p, "Expected " + expected);
		}
	}

	private static final String UID = "uid";
	private static final String KIND = "kind";
	private static final String CLASS_ID = "classId";
	private static final String NAME = "name";
	private static final String DESCRIPTION = "description";
	private static final String TYPE = "type";
	private static final String PARENT = "parent";
	private static final String ATTRIBUTES = "attributes";
	private static final String WORKSPACE = "workspace";
	private static final String TYPES = "types";
	private static final String ENTITIES = "entities";
	private static final String OCTREE_CELLS = "octreeCells";

	private static final JavaType TYPE_LIST_TYPE = TypeFactory.defaultInstance().constructType(new TypeReference<
		List<TypeRecord>>() {});

	private static final JavaType ENTITY_LIST_TYPE = TypeFactory.defaultInstance().constructType(new TypeReference<
		List<EntityRecord>>() {});

	private static final JavaType CELL_MAP_TYPE = TypeFactory.defaultInstance().constructType(new TypeReference<
		LinkedHashMap<UUID, List<OctreeCell>>>() {});
}
