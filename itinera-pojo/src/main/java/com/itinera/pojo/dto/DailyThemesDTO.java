package com.itinera.pojo.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 每天一个主题（内容生成服务的结构化输出）。
 */
@Data
public class DailyThemesDTO {

    public static final String JSON_SHAPE = "{\"themes\":[\"<theme for day 1>\",\"<theme for day 2>\"]}";

    private List<String> themes = new ArrayList<>();
}
