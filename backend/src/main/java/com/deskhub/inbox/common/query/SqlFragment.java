package com.deskhub.inbox.common.query;

import java.util.List;

public record SqlFragment(String sql, List<Object> args) {

    public SqlFragment {
        args = List.copyOf(args);
    }

    public Object[] argArray() {
        return args.toArray();
    }
}
