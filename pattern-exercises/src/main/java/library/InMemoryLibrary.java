package library;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

public class InMemoryLibrary implements LibraryInterface {
    private final List<Book> books = new ArrayList<>();

    @Override
    public void addBook(Book book) {
        books.add(Objects.requireNonNull(book, "book不能为空"));
    }

    @Override
    public void removeBook(String title) {
        Iterator<Book> it = books.iterator();
        while (it.hasNext()) {
            if (it.next().title().equals(title)) {
                it.remove();
                return;
            }
        }
    }

    @Override
    public List<Book> listBooks() {
        return List.copyOf(books);
    }

    @Override
    public String toString() {
        return "InMemoryLibrary{bookCount=" + books.size() + '}';
    }
}
