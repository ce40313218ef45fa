package com.example.identity_gateway.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/** 1 つのヘッダを上書き追加したリクエスト。ヘッダ名は大文字小文字を区別しない。 */
class HeaderAddingRequestWrapper extends HttpServletRequestWrapper {

  private final String headerName;
  private final String headerValue;

  HeaderAddingRequestWrapper(HttpServletRequest request, String headerName, String headerValue) {
    super(request);
    this.headerName = headerName;
    this.headerValue = headerValue;
  }

  @Override
  public String getHeader(String name) {
    if (headerName.equalsIgnoreCase(name)) {
      return headerValue;
    }
    return super.getHeader(name);
  }

  @Override
  public Enumeration<String> getHeaders(String name) {
    if (headerName.equalsIgnoreCase(name)) {
      return Collections.enumeration(List.of(headerValue));
    }
    return super.getHeaders(name);
  }

  @Override
  public Enumeration<String> getHeaderNames() {
    final List<String> names = new ArrayList<>();
    final Enumeration<String> original = super.getHeaderNames();
    while (original != null && original.hasMoreElements()) {
      final String name = original.nextElement();
      if (!headerName.equalsIgnoreCase(name)) {
        names.add(name);
      }
    }
    names.add(headerName);
    return Collections.enumeration(names);
  }
}
