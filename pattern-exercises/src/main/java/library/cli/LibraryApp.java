package library.cli;

import java.io.BufferedReader;
import java.io.InputStreamReader;

import common.LoggingConfig;
import library.InMemoryLibrary;
import library.LibraryInterface;
import library.manager.LibraryManager;

public class LibraryApp {
    public static void main(String[] args) {
        LoggingConfig.setup();

        LibraryInterface library = new InMemoryLibrary();
        LibraryManager manager = new LibraryManager(library);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in));

        new LibraryCommandLoop(manager, in, System.out).run();
    }
}
