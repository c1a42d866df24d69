package com.waybackminer.app.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.waybackminer.core.model.UrlRecord;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 결과 출력기. 값 기준으로 중복을 거른다(처음 본 출처 태그가 남는다).
 * 평문은 한 줄에 URL 하나, JSON 모드는 {"source":..,"value":..} 한 줄.
 */
public final class RecordPrinter implements Closeable {

    private static final ObjectMapper OM = new ObjectMapper();

    private final Writer out;
    private final boolean json;
    private final boolean closeTarget;
    private final Set<String> seen = new HashSet<>();
    private long printed = 0;

    /**
     * @param closeTarget false 면 close() 때 flush 만 한다(System.out 등)
     */
    public RecordPrinter(Writer out, boolean json, boolean closeTarget) {
        this.out = Objects.requireNonNull(out, "out");
        this.json = json;
        this.closeTarget = closeTarget;
    }

    /** 새 값이면 출력하고 true, 이미 출력한 값이면 false */
    public boolean print(UrlRecord r) throws IOException {
        if (!seen.add(r.value())) return false;
        if (json) {
            ObjectNode n = OM.createObjectNode();
            n.put("source", r.source());
            n.put("value", r.value());
            out.write(OM.writeValueAsString(n));
        } else {
            out.write(r.value());
        }
        out.write('\n');
        printed++;
        return true;
    }

    public long printed() { return printed; }

    @Override
    public void close() throws IOException {
        if (closeTarget) out.close();
        else out.flush();
    }
}
