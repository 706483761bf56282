package library.cli;

import java.util.Locale;
import java.util.Optional;

public enum Command {
    ADD, REMOVE, SHOW, EXIT;

    /**
     * 去掉首尾空白并转小写后匹配；无法识别时返回空。
     */
    public static Optional<Command> parse(String input) {
        if (input == null) {
            return Optional.empty();
        }
        String normalized = input.trim().toLowerCase(Locale.ROOT);
        for (Command command : values()) {
            if (command.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
