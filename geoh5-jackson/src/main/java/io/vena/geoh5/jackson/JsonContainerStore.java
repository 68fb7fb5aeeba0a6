package io.vena.geoh5.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.vena.geoh5.OctreeCell;
import io.vena.geoh5.store.ContainerChanges;
import io.vena.geoh5.store.ContainerSnapshot;
import io.vena.geoh5.store.ContainerStore;
import io.vena.geoh5.store.MemoryContainerStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * A {@link ContainerStore} backed by a single JSON file.
 *
 * <p>
 * The file is read once, when the store is constructed. Each {@link #commit}
 * applies the changes in memory and then rewrites the whole file,
 * by way of a temporary file in the same directory,
 * so a failed write leaves the previous version intact.
 */
public class JsonContainerStore implements ContainerStore {
	@Getter private final Path file;
	private final ObjectMapper mapper;
	private final ObjectWriter writer;
	private final MemoryContainerStore contents;

	public JsonContainerStore(Path file) throws IOException {
		this(file, JsonStoreSettings.defaults());
	}

	/**
	 * @throws NoSuchFileException if <code>file</code> doesn't exist
	 * and {@link JsonStoreSettings#createIfMissing()} is false
	 */
	public JsonContainerStore(@NonNull Path file, @NonNull JsonStoreSettings settings) throws IOException {
		this.file = file;
		this.mapper = new ObjectMapper().registerModule(new Geoh5JacksonModule());
		this.writer = settings.prettyPrint() ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
		if (Files.exists(file)) {
			this.contents = load();
		} else if (settings.createIfMissing()) {
			LOGGER.debug("No container at {}; starting empty", file);
			this.contents = new MemoryContainerStore();
		} else {
			throw new NoSuchFileException(file.toString());
		}
	}

	@Override
	public Optional<ContainerSnapshot> read() {
		return contents.read();
	}

	@Override
	public List<OctreeCell> fetchOctreeCells(UUID octreeUid) {
		return contents.fetchOctreeCells(octreeUid);
	}

	@Override
	public void commit(ContainerChanges changes) throws IOException {
		contents.commit(changes);
		write();
	}

	private MemoryContainerStore load() throws IOException {
		ContainerDocument document = mapper.readValue(file.toFile(), ContainerDocument.class);
		LOGGER.debug("Loaded {} types and {} entities from {}", document.types().size(), document.entities().size(), file);
		return new MemoryContainerStore(
			new ContainerSnapshot(document.workspace(), document.types(), document.entities()),
			document.octreeCells());
	}

	private void write() throws IOException {
		ContainerSnapshot snapshot = contents.snapshot();
		ContainerDocument document = new ContainerDocument(
			snapshot.workspaceAttributes(),
			snapshot.types(),
			snapshot.entities(),
			contents.allOctreeCells());
		Path directory = file.toAbsolutePath().getParent();
		Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
		try {
			writer.writeValue(temp.toFile(), document);
			Files.move(temp, file, REPLACE_EXISTING, ATOMIC_MOVE);
		} catch (IOException e) {
			Files.deleteIfExists(temp);
			throw e;
		}
		LOGGER.debug("Wrote {} types and {} entities to {}", snapshot.types().size(), snapshot.entities().size(), file);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonContainerStore.class);
}
