package com.logscale.query;

/**
 * 解析器传给词法器的上下文标志。
 */
public enum LexMode {
    /** 过滤上下文：允许未加引号的模式与正则字面量 */
    FILTER,
    /** 表达式上下文：'/' 是除号，'*'、'+'、'-' 是运算符 */
    EXPRESSION
}
