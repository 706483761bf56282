package library.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import library.manager.LibraryManager;

/**
 * 单线程阻塞式命令循环。
 * <p>
 * {@code exit} 或输入结束时 {@link #run()} 返回，是否退出进程由调用方决定。
 * 输入在 {@code add} 的中途结束时，已输入的部分被丢弃。
 */
public class LibraryCommandLoop {
    static final String COMMAND_PROMPT = "Enter command (add, remove, show, exit): ";
    static final String TITLE_PROMPT = "Enter book title: ";
    static final String AUTHOR_PROMPT = "Enter book author: ";
    static final String YEAR_PROMPT = "Enter book year: ";
    static final String REMOVE_PROMPT = "Enter book title to remove: ";
    static final String INVALID_COMMAND_MESSAGE = "Invalid command. Please try again.";

    private static final Logger LOG = Logger.getLogger(LibraryCommandLoop.class.getName());

    private final LibraryManager manager;
    private final BufferedReader in;
    private final PrintStream prompts;

    public LibraryCommandLoop(LibraryManager manager, BufferedReader in, PrintStream prompts) {
        this.manager = Objects.requireNonNull(manager, "manager不能为空");
        this.in = Objects.requireNonNull(in, "in不能为空");
        this.prompts = Objects.requireNonNull(prompts, "prompts不能为空");
    }

    public void run() {
        while (true) {
            String line = prompt(COMMAND_PROMPT);
            if (line == null) {
                LOG.fine("End of input, leaving command loop");
                return;
            }
            Optional<Command> command = Command.parse(line);
            if (command.isEmpty()) {
                LOG.warning(INVALID_COMMAND_MESSAGE);
                continue;
            }
            if (!dispatch(command.get())) {
                return;
            }
        }
    }

    /**
     * @return 循环是否继续
     */
    private boolean dispatch(Command command) {
        switch (command) {
            case ADD: {
                String title = prompt(TITLE_PROMPT);
                if (title == null) return false;
                String author = prompt(AUTHOR_PROMPT);
                if (author == null) return false;
                String year = prompt(YEAR_PROMPT);
                if (year == null) return false;
                manager.addBook(title.trim(), author.trim(), year.trim());
                return true;
            }
            case REMOVE: {
                String title = prompt(REMOVE_PROMPT);
                if (title == null) return false;
                manager.removeBook(title.trim());
                return true;
            }
            case SHOW:
                manager.showBooks();
                return true;
            case EXIT:
                return false;
            default:
                throw new IllegalStateException("未处理的命令: " + command);
        }
    }

    // 返回 null 表示输入已结束
    private String prompt(String text) {
        prompts.print(text);
        prompts.flush();
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
