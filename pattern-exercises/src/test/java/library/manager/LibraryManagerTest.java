package library.manager;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import common.LogCapture;
import library.Book;
import library.InMemoryLibrary;
import library.KeyedLibrary;
import library.LibraryInterface;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

@DisplayName("LibraryManager")
class LibraryManagerTest {

    private LogCapture logs;

    @BeforeEach
    void attachLogs() {
        logs = LogCapture.attach("library");
    }

    @AfterEach
    void detachLogs() {
        logs.close();
    }

    @Test
    @DisplayName("Should log one line per book in insertion order")
    void shouldLogOneLinePerBook() {
        LibraryManager manager = new LibraryManager(new InMemoryLibrary());
        manager.addBook("Dune", "Frank Herbert", "1965");
        manager.addBook("Emma", "Jane Austen", "1815");

        manager.showBooks();

        assertThat(logs.messages(Level.INFO)).containsExactly(
                "Title: Dune, Author: Frank Herbert, Year: 1965",
                "Title: Emma, Author: Jane Austen, Year: 1815");
    }

    @Test
    @DisplayName("Should log a single line when there are no books")
    void shouldLogNoBooks() {
        new LibraryManager(new InMemoryLibrary()).showBooks();

        assertThat(logs.messages(Level.INFO)).containsExactly(LoggingBookFormatter.NO_BOOKS_MESSAGE);
    }

    @Test
    @DisplayName("Should delegate all state to the injected library")
    void shouldDelegateToLibrary() {
        LibraryInterface library = new KeyedLibrary();
        LibraryManager manager = new LibraryManager(library);

        manager.addBook("Dune", "Frank Herbert", "1965");
        assertThat(library.listBooks()).containsExactly(new Book("Dune", "Frank Herbert", "1965"));

        manager.removeBook("Dune");
        assertThat(library.listBooks()).isEmpty();
    }

    @Test
    @DisplayName("Should behave the same over either library implementation")
    void shouldBehaveTheSameOverEitherLibrary() {
        List<List<Book>> shown = new ArrayList<>();
        for (LibraryInterface library : List.of(new InMemoryLibrary(), new KeyedLibrary())) {
            List<Book> captured = new ArrayList<>();
            LibraryManager manager = new LibraryManager(library, captured::addAll);

            manager.addBook("Dune", "Frank Herbert", "1965");
            manager.addBook("Emma", "Jane Austen", "1815");
            manager.addBook("Dune", "Frank Herbert", "1990");
            manager.removeBook("Dune");
            manager.removeBook("Ulysses");
            manager.showBooks();

            shown.add(captured);
        }

        assertThat(shown.get(0)).isEqualTo(shown.get(1)).containsExactly(
                new Book("Emma", "Jane Austen", "1815"),
                new Book("Dune", "Frank Herbert", "1990"));
    }

    @Test
    @DisplayName("Should require a library")
    void shouldRequireLibrary() {
        assertThatNullPointerException().isThrownBy(() -> new LibraryManager(null));
    }
}
