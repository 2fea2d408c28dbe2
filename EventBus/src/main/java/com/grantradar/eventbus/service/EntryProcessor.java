package com.grantradar.eventbus.service;

import java.util.Map;

/**
 * Business logic applied to one stream record.
 */
@FunctionalInterface
public interface EntryProcessor {

    void process(Map<String, String> fields) throws Exception;
}
