package com.svdac.parser;

import com.svdac.model.SourceToken;

import java.util.List;

/**
 * token 序列上的消费游标，展平器的各个递归分支共享同一个游标
 */
public class TokenCursor {

    private final List<SourceToken> tokens;
    private int position;

    public TokenCursor(List<SourceToken> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public boolean hasNext() {
        return position < tokens.size();
    }

    public SourceToken next() {
        return tokens.get(position++);
    }

    /** 当前 token，已耗尽时返回 null */
    public SourceToken peek() {
        return peek(0);
    }

    public SourceToken peek(int offset) {
        int idx = position + offset;
        return idx < tokens.size() ? tokens.get(idx) : null;
    }

    public boolean nextIs(String keyword) {
        SourceToken token = peek();
        return token != null && token.is(keyword);
    }

    public void skip(int count) {
        position = Math.min(tokens.size(), position + count);
    }
}
