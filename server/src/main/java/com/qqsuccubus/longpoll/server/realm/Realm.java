package com.qqsuccubus.longpoll.server.realm;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class Realm {
    private final long id;
    private final String domain;
    private String name;

    // emoji name -> image url
    private final Map<String, String> emoji = new LinkedHashMap<>();
    // [pattern, url format] pairs, in creation order
    private final List<List<String>> filters = new ArrayList<>();
}
