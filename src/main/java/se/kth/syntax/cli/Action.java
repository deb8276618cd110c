package se.kth.syntax.cli;

import java.util.Arrays;
import java.util.stream.Collectors;
import picocli.CommandLine;

/**
 * What the CLI does with the tree it reads.
 */
public enum Action {
    PRINT("print"),
    DUMP_FULL_TOKENS("dump-full-tokens"),
    SERIALIZE_RAW_TREE("serialize-raw-tree"),
    DUMP_TREE("dump-tree"),
    VERIFY("verify");

    private final String optionName;

    Action(String optionName) {
        this.optionName = optionName;
    }

    public String getOptionName() {
        return optionName;
    }

    public static Action fromOptionName(String name) {
        for (Action action : values()) {
            if (action.optionName.equals(name)) {
                return action;
            }
        }
        throw new IllegalArgumentException(
                "Unknown action '" + name + "', expected one of " + names());
    }

    static String names() {
        return Arrays.stream(values()).map(Action::getOptionName).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return optionName;
    }

    static class Converter implements CommandLine.ITypeConverter<Action> {
        @Override
        public Action convert(String value) {
            try {
                return fromOptionName(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
