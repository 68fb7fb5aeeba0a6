package io.vena.geoh5;

import io.vena.geoh5.store.AttributeMap;
import java.util.UUID;
import lombok.NonNull;

/**
 * A single text value, such as a comment, attached to an object.
 */
public final class TextData extends Data {
	public static final DataClass<TextData> CLASS = new DataClass<>(TextData.class, PrimitiveType.TEXT, TextData::new);

	private String text = "";

	TextData(Workspace workspace, UUID uid, String name, DataType entityType) {
		super(workspace, uid, name, entityType);
	}

	@Override
	public PrimitiveType primitiveType() {
		return PrimitiveType.TEXT;
	}

	public String text() {
		return text;
	}

	public void text(@NonNull String newText) {
		text = newText;
		markModified();
	}

	@Override
	protected AttributeMap attributes() {
		return super.attributes().with(VALUES, text);
	}

	@Override
	protected void readAttributes(AttributeMap attributes) {
		super.readAttributes(attributes);
		text = attributes.string(VALUES).orElse("");
	}
}
