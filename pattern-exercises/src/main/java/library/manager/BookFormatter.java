package library.manager;

import java.util.List;

import library.Book;

public interface BookFormatter {
    void logBooks(List<Book> books);
}
