package com.mmrag.capability;

public interface CompletionService {
    String complete(String prompt);
}
