package library;

import java.util.List;

/**
 * 藏书存储契约。实现可以替换，管理器与命令行无需改动。
 */
public interface LibraryInterface {
    /**
     * 追加一本书，保留插入顺序，允许重复。
     */
    void addBook(Book book);

    /**
     * 删除第一本书名完全相同的书；不存在时什么也不做。
     */
    void removeBook(String title);

    /**
     * 按插入顺序返回只读快照；没有书时返回空列表。
     */
    List<Book> listBooks();
}
