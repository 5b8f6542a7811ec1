package com.linkscout.core.service.export;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.linkscout.core.model.TreeNode;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * 링크 트리를 JSON 으로 저장/로드.
 * 형태: {"url", "title", "links": [...], "children": [ ...재귀... ]}
 * 트리가 없으면(시드 실패) JSON null 을 쓴다.
 *
 * 트리 깊이에 제한이 없으므로 databind 대신 스트리밍 API 를 명시적 스택으로 돌린다.
 * 노드 하나가 중첩 2단(object + children 배열)을 쓰므로 Jackson 기본 중첩 제한(1000)도 풀어둔다.
 */
public class TreeJsonExporter {

    // 들여쓰기는 이 깊이까지만 늘어난다(깊은 체인에서 공백이 제곱으로 불어나지 않게)
    static final int MAX_INDENT_LEVEL = 32;

    private final JsonFactory factory = new JsonFactoryBuilder()
            .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
            .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
            .build();

    public Path export(Path file, TreeNode root) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (JsonGenerator g = factory.createGenerator(file.toFile(), JsonEncoding.UTF8)) {
            write(g, root);
        }
        return file;
    }

    public String toJson(TreeNode root) throws IOException {
        StringWriter sw = new StringWriter();
        try (JsonGenerator g = factory.createGenerator(sw)) {
            write(g, root);
        }
        return sw.toString();
    }

    /** 저장된 트리를 다시 읽는다. JSON null 이면 empty. 모르는 필드는 무시 */
    public Optional<TreeNode> read(Path file) throws IOException {
        try (JsonParser p = factory.createParser(file.toFile())) {
            return Optional.ofNullable(read(p));
        }
    }

    private static void write(JsonGenerator g, TreeNode root) throws IOException {
        g.setPrettyPrinter(new DefaultPrettyPrinter().withObjectIndenter(new CappedIndenter()));
        if (root == null) {
            g.writeNull();
            return;
        }
        Deque<Iterator<TreeNode>> stack = new ArrayDeque<>();
        writeOpen(g, root);
        stack.push(root.getChildren().iterator());
        while (!stack.isEmpty()) {
            Iterator<TreeNode> it = stack.peek();
            if (it.hasNext()) {
                TreeNode child = it.next();
                writeOpen(g, child);
                stack.push(child.getChildren().iterator());
            } else {
                stack.pop();
                g.writeEndArray();   // children
                g.writeEndObject();
            }
        }
    }

    // children 배열 여는 데까지 쓴다. 닫는 건 스택이 비울 때
    private static void writeOpen(JsonGenerator g, TreeNode n) throws IOException {
        g.writeStartObject();
        g.writeStringField("url", n.getUrl());
        g.writeStringField("title", n.getTitle());
        g.writeArrayFieldStart("links");
        for (String link : n.getLinks()) g.writeString(link);
        g.writeEndArray();
        g.writeArrayFieldStart("children");
    }

    private static TreeNode read(JsonParser p) throws IOException {
        JsonToken first = p.nextToken();
        if (first == null || first == JsonToken.VALUE_NULL) return null;
        if (first != JsonToken.START_OBJECT) {
            throw new JsonParseException(p, "link tree must be an object or null, got " + first);
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame());
        while (true) {
            JsonToken t = p.nextToken();
            if (t == null) throw new JsonParseException(p, "unexpected end of link tree");
            Frame f = stack.peek();

            if (f.inChildren) {
                if (t == JsonToken.START_OBJECT) {
                    stack.push(new Frame());
                } else if (t == JsonToken.END_ARRAY) {
                    f.inChildren = false;
                } else {
                    throw new JsonParseException(p, "children must hold objects, got " + t);
                }
                continue;
            }

            if (t == JsonToken.END_OBJECT) {
                TreeNode node = f.toNode(p);
                stack.pop();
                if (stack.isEmpty()) return node;
                stack.peek().children.add(node);
                continue;
            }
            if (t != JsonToken.FIELD_NAME) throw new JsonParseException(p, "unexpected token " + t);

            String name = p.currentName();
            JsonToken v = p.nextToken();
            switch (name) {
                case "url":
                    f.url = p.getValueAsString();
                    break;
                case "title":
                    f.title = p.getValueAsString();
                    break;
                case "links":
                    if (v == JsonToken.START_ARRAY) {
                        while (p.nextToken() != JsonToken.END_ARRAY) f.links.add(p.getValueAsString());
                    } else {
                        p.skipChildren();
                    }
                    break;
                case "children":
                    if (v == JsonToken.START_ARRAY) f.inChildren = true;
                    else p.skipChildren();
                    break;
                default:
                    p.skipChildren();
            }
        }
    }

    /** 읽는 중인 노드 하나 */
    private static final class Frame {
        String url;
        String title;
        final List<String> links = new ArrayList<>();
        final List<TreeNode> children = new ArrayList<>();
        boolean inChildren;

        TreeNode toNode(JsonParser p) throws JsonParseException {
            if (url == null) throw new JsonParseException(p, "link tree node without url");
            return new TreeNode(url, title, links, children);
        }
    }

    /** 일정 깊이 이후로는 들여쓰기를 고정 */
    static final class CappedIndenter extends DefaultIndenter {
        @Override
        public void writeIndentation(JsonGenerator g, int level) throws IOException {
            super.writeIndentation(g, Math.min(level, MAX_INDENT_LEVEL));
        }
    }
}
