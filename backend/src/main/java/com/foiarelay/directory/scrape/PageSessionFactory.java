package com.foiarelay.directory.scrape;

public interface PageSessionFactory {

    String engine();

    PageSession open(int workerIndex);
}
