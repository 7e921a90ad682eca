package io.coldtag.cli.commands;

import io.coldtag.cli.ui.AnsiStyles;
import io.coldtag.core.function.FunctionKind;
import io.coldtag.core.function.InputRole;
import io.coldtag.core.tag.TagType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Lists the function catalogue.
///
/// ### Usage
/// ```bash
/// coldtag kinds
/// coldtag kinds --tag-type location
/// ```
@Command(
        name = "kinds",
        description = "List function kinds",
        mixinStandardHelpOptions = true)
public class KindsCommand extends ColdtagCommand {

    @Option(
            names = "--tag-type",
            description = "Only kinds a tag of this type can host (location, number, date, datetime)")
    private String tagType;

    @Override
    protected int execute() {
        AnsiStyles styles = styles();
        List<FunctionKind> kinds;
        if (tagType == null) {
            kinds = Arrays.asList(FunctionKind.values());
        } else {
            Optional<TagType> type = TagType.fromId(tagType);
            if (type.isEmpty()) {
                System.err.println(styles.crossmark() + " Unknown tag type: " + tagType);
                return EXIT_INPUT_ERROR;
            }
            kinds = FunctionKind.forTagType(type.get());
            if (kinds.isEmpty()) {
                System.out.println("No function kinds for tag type " + tagType);
                return 0;
            }
        }

        System.out.printf(
                "%-28s %-15s %-9s %-4s %s%n", "KIND", "FAMILY", "OUTPUT", "DP", "INPUTS");
        System.out.println(styles.separator());
        for (FunctionKind kind : kinds) {
            System.out.printf(
                    "%-28s %-15s %-9s %-4s %s%n",
                    kind.getId(),
                    lower(kind.getFamily().name()),
                    lower(kind.getCategory().name()),
                    kind.getPrecision().isPresent()
                            ? String.valueOf(kind.getPrecision().getAsInt())
                            : "-",
                    inputs(kind));
            System.out.println("  " + styles.dim(kind.getLabel()));
        }
        return 0;
    }

    private static String inputs(FunctionKind kind) {
        List<String> names = new ArrayList<>();
        for (InputRole role : kind.getInputRoles()) {
            names.add(lower(role.name()) + (role.isDefaulted() ? "?" : ""));
        }
        return String.join(", ", names);
    }

    private static String lower(String name) {
        return name.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
