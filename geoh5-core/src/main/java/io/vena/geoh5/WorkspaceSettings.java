package io.vena.geoh5;

import java.util.List;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

import static java.util.Collections.singletonList;

/**
 * Settings for a new {@link Workspace}. When a workspace is opened from a store
 * that already holds a container, the container's own version, distance unit,
 * and contributors take precedence.
 */
@Value
@Builder
public class WorkspaceSettings {
	@Default double version = 1.0;
	@Default String distanceUnit = "meter";
	@Default List<String> contributors = singletonList(System.getProperty("user.name", "unknown"));

	/**
	 * Whether {@link Workspace#close()} saves pending changes to the store.
	 */
	@Default boolean saveOnClose = true;

	public static WorkspaceSettings defaults() {
		return WorkspaceSettings.builder().build();
	}
}
