package com.dbus.deviation.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.dbus.deviation.cli.exception.OptionsValidationException;
import com.dbus.deviation.cli.model.DiffConfig;
import com.dbus.deviation.cli.model.DiffOptions;
import com.dbus.deviation.comparison.Severity;

public class DiffOptionsValidator {

	static final String ALL = "all";
	static final String NONE = "none";

	public DiffConfig validate(DiffOptions o) {
		List<String> errors = new ArrayList<>();

		checkInputFile("Old", o.getOldFile(), errors);
		checkInputFile("New", o.getNewFile(), errors);

		Set<Severity> enabled = parseCategories(o.getWarnings(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return DiffConfig.builder()
				.oldFile(o.getOldFile())
				.newFile(o.getNewFile())
				.enabledSeverities(enabled)
				.recover(!o.isFailFast())
				.fatalForwards(o.isFatalForwards())
				.build();
	}

	private static void checkInputFile(String which, Path file, List<String> errors) {
		if (file == null) {
			errors.add(which + " interface file is required.");
		} else if (!Files.isRegularFile(file)) {
			errors.add(which + " interface file does not exist or is not a regular file: " + file);
		}
	}

	private static Set<Severity> parseCategories(List<String> raw, List<String> errors) {
		Set<Severity> enabled = EnumSet.noneOf(Severity.class);
		if (raw == null) {
			return EnumSet.allOf(Severity.class);
		}

		for (String category : raw) {
			String trimmed = category.trim();
			if (trimmed.isEmpty() || NONE.equals(trimmed)) {
				continue;
			}
			if (ALL.equals(trimmed)) {
				enabled.addAll(EnumSet.allOf(Severity.class));
				continue;
			}
			Optional<Severity> severity = Severity.fromCategory(trimmed);
			if (severity.isPresent()) {
				enabled.add(severity.get());
			} else {
				errors.add("Unknown warning category '" + trimmed
						+ "'. Expected info, forwards-compatibility, backwards-compatibility, all or none.");
			}
		}
		return enabled;
	}
}
