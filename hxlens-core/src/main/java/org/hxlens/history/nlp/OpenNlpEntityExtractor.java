package org.hxlens.history.nlp;

/*
 * This file is part of HxLens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * HxLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * HxLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with HxLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.hxlens.history.om.MedicalEntity;
import org.hxlens.history.util.Logger;

import opennlp.tools.namefind.NameFinderME;
import opennlp.tools.namefind.TokenNameFinderModel;
import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.util.Span;

/**
 * Entity extraction backed by an OpenNLP name finder model (for example one
 * trained with DISEASE, TREATMENT and SYMPTOM types).
 * <p>
 * The model is loaded once; {@link NameFinderME} is not thread-safe, so each
 * thread gets its own finder. A missing or unreadable model leaves the
 * extractor unavailable and every call returns an empty list.
 */
public class OpenNlpEntityExtractor implements EntityExtractor {

	private final TokenNameFinderModel model;
	private final ThreadLocal<NameFinderME> finder;

	public OpenNlpEntityExtractor(String modelPath) {
		this.model = loadModel(modelPath);
		this.finder = ThreadLocal.withInitial(() -> model == null ? null : new NameFinderME(model));
	}

	/** Build an extractor for the configured model, or the no-op one when none is set. */
	public static EntityExtractor forModel(String modelPath) {
		if (modelPath == null || modelPath.isBlank()) {
			return NoOpEntityExtractor.INSTANCE;
		}
		OpenNlpEntityExtractor ex = new OpenNlpEntityExtractor(modelPath);
		return ex.isAvailable() ? ex : NoOpEntityExtractor.INSTANCE;
	}

	@Override
	public boolean isAvailable() {
		return model != null;
	}

	@Override
	public List<MedicalEntity> extract(String text) {
		if (model == null || text == null || text.isBlank()) {
			return Collections.emptyList();
		}

		List<MedicalEntity> out = new ArrayList<>();
		Span[] tokenSpans = SimpleTokenizer.INSTANCE.tokenizePos(text);
		String[] tokens = Span.spansToStrings(tokenSpans, text);
		try {
			NameFinderME nf = finder.get();
			for (Span s : nf.find(tokens)) {
				int start = tokenSpans[s.getStart()].getStart();
				int end = tokenSpans[s.getEnd() - 1].getEnd();
				out.add(new MedicalEntity(text.substring(start, end), s.getType().toUpperCase(Locale.ROOT), start,
						end, s.getProb()));
			}
			nf.clearAdaptiveData();
		} catch (RuntimeException e) {
			Logger.warn("Name finder hiccup; rebuilding for this thread: {}", e.toString());
			finder.remove();
			return Collections.emptyList();
		}
		return out;
	}

	private static TokenNameFinderModel loadModel(String path) {
		try (InputStream in = tryOpen(path)) {
			if (in == null) {
				Logger.warn("Entity model not found: {}; continuing without entity extraction", path);
				return null;
			}
			return new TokenNameFinderModel(in);
		} catch (Exception e) {
			Logger.warn("Entity model could not be loaded from {}: {}", path, e.getMessage());
			return null;
		}
	}

	/** Try file system first, then classpath. */
	private static InputStream tryOpen(String path) throws IOException {
		if (path == null || path.isBlank()) {
			return null;
		}
		Path p = Path.of(path);
		if (Files.isReadable(p)) {
			return new FileInputStream(p.toFile());
		}
		return OpenNlpEntityExtractor.class.getClassLoader().getResourceAsStream(path);
	}
}
