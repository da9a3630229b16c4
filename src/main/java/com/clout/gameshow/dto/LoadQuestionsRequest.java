package com.clout.gameshow.dto;

import lombok.Data;

@Data
public class LoadQuestionsRequest {

    /**
     * Bare file name inside the questions directory.
     */
    private String filename;
}
