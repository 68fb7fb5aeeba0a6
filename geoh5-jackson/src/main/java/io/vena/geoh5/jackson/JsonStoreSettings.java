package io.vena.geoh5.jackson;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder
public class JsonStoreSettings {
	/**
	 * Indent the file for human readers.
	 */
	@Default boolean prettyPrint = false;

	/**
	 * If false, opening a store on a file that doesn't exist fails
	 * rather than starting an empty container.
	 */
	@Default boolean createIfMissing = true;

	public static JsonStoreSettings defaults() {
		return JsonStoreSettings.builder().build();
	}
}
