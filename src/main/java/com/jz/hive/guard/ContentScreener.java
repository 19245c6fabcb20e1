package com.jz.hive.guard;

/**
 * 消息内容筛查。纯函数，无 IO；以后换成统计/模型分类器时调用方不用改。
 */
public interface ContentScreener {
    ScreenVerdict screen(String text);
}
