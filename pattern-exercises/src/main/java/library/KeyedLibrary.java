package library;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 以插入序号为键的存储，对外行为与 {@link InMemoryLibrary} 一致。
 */
public class KeyedLibrary implements LibraryInterface {
    private final Map<Long, Book> catalogue = new LinkedHashMap<>();  // key: 插入序号
    private long nextKey;

    @Override
    public void addBook(Book book) {
        catalogue.put(nextKey++, Objects.requireNonNull(book, "book不能为空"));
    }

    @Override
    public void removeBook(String title) {
        Iterator<Book> it = catalogue.values().iterator();
        while (it.hasNext()) {
            if (it.next().title().equals(title)) {
                it.remove();
                return;
            }
        }
    }

    @Override
    public List<Book> listBooks() {
        return List.copyOf(catalogue.values());
    }

    @Override
    public String toString() {
        return "KeyedLibrary{bookCount=" + catalogue.size() + ", nextKey=" + nextKey + '}';
    }
}
