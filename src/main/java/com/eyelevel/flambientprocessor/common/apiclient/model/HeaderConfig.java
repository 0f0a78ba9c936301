package com.eyelevel.flambientprocessor.common.apiclient.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Static headers sent with every API call of a client (never with signed transfer URLs).
 */
@Getter
@Setter
public class HeaderConfig {

    private List<Header> headers = new ArrayList<>();

    public HeaderConfig addHeader(String name, String value) {
        Header header = new Header();
        header.setName(name);
        header.setValue(value);
        headers.add(header);
        return this;
    }

    /**
     * Represents a single header with a name and a value.
     */
    @Getter
    @Setter
    public static class Header {

        private String name;
        private String value;
    }
}
