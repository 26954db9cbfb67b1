package com.mike.leadscout.browser;

public interface BrowserSessionFactory {

    BrowserSession open();
}
