package library.manager;

import java.util.Objects;

import library.Book;
import library.LibraryInterface;

/**
 * 管理器：只依赖 {@link LibraryInterface}，自身不保存任何书籍状态。
 */
public class LibraryManager {
    private final LibraryInterface library;
    private final BookFormatter formatter;

    public LibraryManager(LibraryInterface library) {
        this(library, new LoggingBookFormatter());
    }

    public LibraryManager(LibraryInterface library, BookFormatter formatter) {
        this.library = Objects.requireNonNull(library, "library不能为空");
        this.formatter = Objects.requireNonNull(formatter, "formatter不能为空");
    }

    public void addBook(String title, String author, String year) {
        library.addBook(new Book(title, author, year));
    }

    public void removeBook(String title) {
        library.removeBook(title);
    }

    public void showBooks() {
        formatter.logBooks(library.listBooks());
    }
}
