package library;

import java.util.Objects;

/**
 * 书籍：创建后不可变，书名作为删除时的匹配键。
 */
public record Book(String title, String author, String year) {
    public Book {
        Objects.requireNonNull(title, "title不能为空");
        Objects.requireNonNull(author, "author不能为空");
        Objects.requireNonNull(year, "year不能为空");
    }

    @Override
    public String toString() {
        return "Title: " + title + ", Author: " + author + ", Year: " + year;
    }
}
