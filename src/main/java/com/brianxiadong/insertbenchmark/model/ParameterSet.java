package com.brianxiadong.insertbenchmark.model;

import com.brianxiadong.insertbenchmark.exception.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 测试参数网格
 * 文本形式为空格分隔的 {@code <batchCount>x<batchSize>}，例如 {@code "1x100000 10x10000"}
 */
public final class ParameterSet {

    private static final String SEPARATOR = "x";

    private final List<Parameter> parameters;

    public ParameterSet(List<Parameter> parameters) {
        this.parameters = List.copyOf(parameters);
    }

    /**
     * 解析参数网格文本
     *
     * @param text 例如 "1x100000 10x10000"
     * @return 参数网格
     * @throws ConfigurationException 任一项格式不正确时
     */
    public static ParameterSet parse(String text) {
        if (text == null) {
            throw new ConfigurationException("参数网格不能为空");
        }
        List<Parameter> result = new ArrayList<>();
        for (String token : text.split(" ")) {
            String[] parts = token.split(SEPARATOR, -1);
            if (parts.length != 2) {
                throw new ConfigurationException("无效的参数: " + token + " (参数网格: " + text + ")");
            }
            result.add(new Parameter(parseCount(parts[0], token), parseCount(parts[1], token)));
        }
        return new ParameterSet(result);
    }

    private static int parseCount(String s, String token) {
        if (s.isEmpty() || !s.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new ConfigurationException("无效的数字 '" + s + "' (参数: " + token + ")");
        }
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("无效的数字 '" + s + "' (参数: " + token + ")", e);
        }
    }

    /**
     * 按总行数分组，组按总行数升序，组内保持原有顺序
     */
    public List<ParameterSet> groupByTotalRows() {
        Map<Long, List<Parameter>> groups = new TreeMap<>();
        for (Parameter prm : parameters) {
            groups.computeIfAbsent(prm.totalRows(), k -> new ArrayList<>()).add(prm);
        }
        return groups.values().stream()
                .map(ParameterSet::new)
                .collect(Collectors.toList());
    }

    public List<Parameter> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public int size() {
        return parameters.size();
    }

    /**
     * 格式化为文本形式，与 {@link #parse(String)} 互逆
     */
    @JsonValue
    public String format() {
        return parameters.stream()
                .map(Parameter::toString)
                .collect(Collectors.joining(" "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParameterSet)) {
            return false;
        }
        return parameters.equals(((ParameterSet) o).parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameters);
    }

    @Override
    public String toString() {
        return format();
    }
}
