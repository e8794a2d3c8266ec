package org.metricshub.roboscript.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * RoboScript
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A RoboScript program read from a UTF-8 file.
 * <p>
 * The file is opened on the first call to {@link #getReader()} and released
 * by {@link #close()}. A closed source opens the file again from its start,
 * so the same instance can be compiled more than once.
 */
public class ScriptFileSource extends ScriptSource {

	private final Path path;
	private Reader fileReader;

	/**
	 * @param filePath path of the program file
	 */
	public ScriptFileSource(String filePath) {
		this(Paths.get(filePath));
	}

	/**
	 * @param path the program file
	 */
	public ScriptFileSource(Path path) {
		super(path.toString(), null);
		this.path = path;
	}

	/**
	 * @return the program file
	 */
	public Path getPath() {
		return path;
	}

	/**
	 * Verifies that the program file exists and can be read, without opening it.
	 *
	 * @throws NoSuchFileException if the path is not a regular file
	 * @throws AccessDeniedException if the file is not readable
	 */
	public void checkReadable() throws IOException {
		if (!Files.isRegularFile(path)) {
			throw new NoSuchFileException(path.toString());
		}
		if (!Files.isReadable(path)) {
			throw new AccessDeniedException(path.toString());
		}
	}

	/**
	 * @return {@code true} while the file is open
	 */
	public boolean isOpen() {
		return fileReader != null;
	}

	/** {@inheritDoc} */
	@Override
	public Reader getReader() throws IOException {
		if (fileReader == null) {
			fileReader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
		}
		return fileReader;
	}

	/** {@inheritDoc} */
	@Override
	public void close() throws IOException {
		if (fileReader != null) {
			try {
				fileReader.close();
			} finally {
				fileReader = null;
			}
		}
	}
}
