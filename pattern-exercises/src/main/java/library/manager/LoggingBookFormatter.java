package library.manager;

import java.util.List;
import java.util.logging.Logger;

import library.Book;

/**
 * 每本书输出一行 INFO 日志；空列表时输出一行提示。
 */
public class LoggingBookFormatter implements BookFormatter {
    public static final String NO_BOOKS_MESSAGE = "No books in the library.";

    private static final Logger LOG = Logger.getLogger(LoggingBookFormatter.class.getName());

    @Override
    public void logBooks(List<Book> books) {
        if (books.isEmpty()) {
            LOG.info(NO_BOOKS_MESSAGE);
            return;
        }
        for (Book book : books) {
            LOG.info(book.toString());
        }
    }
}
