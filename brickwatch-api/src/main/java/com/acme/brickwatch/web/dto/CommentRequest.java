package com.acme.brickwatch.web.dto;

public record CommentRequest(String comment) {}
