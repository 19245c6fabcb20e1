package com.jz.hive.dev;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 开发/压测环境专用：
 * - 从请求头 X-UID / X-UNAME（或查询参数 uid / uname）读取身份
 * - 写入 HttpSession 的 "UID" / "UNAME"，以满足 @SessionAttribute("UID")
 *
 * 生产环境由鉴权服务写会话，这个过滤器不加载。
 */
@Component
@Profile({"dev", "perf"})
public class DevUidInjectionFilter extends OncePerRequestFilter {

    public static final String UID_KEY = "UID";
    public static final String UNAME_KEY = "UNAME";

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse resp, FilterChain chain)
            throws ServletException, IOException {

        String uid = firstNonBlank(req.getHeader("X-UID"), req.getParameter("uid"));
        if (uid != null) {
            HttpSession session = req.getSession(true);
            // 压测时同一个 cookie 可能换人，以请求头为准
            session.setAttribute(UID_KEY, uid.trim());
            String uname = firstNonBlank(req.getHeader("X-UNAME"), req.getParameter("uname"));
            session.setAttribute(UNAME_KEY, uname == null ? uid.trim() : uname.trim());
        }
        chain.doFilter(req, resp);
    }

    private String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        if (b != null && !b.isBlank()) return b;
        return null;
    }
}
