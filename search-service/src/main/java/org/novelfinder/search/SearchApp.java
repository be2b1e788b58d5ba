package org.novelfinder.search;

import org.novelfinder.search.bootstrap.SearchBootstrap;

public class SearchApp {
    public static void main(String[] args) {
        SearchBootstrap.run(args);
    }
}
