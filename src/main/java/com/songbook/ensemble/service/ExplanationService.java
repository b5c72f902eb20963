package com.songbook.ensemble.service;

import com.songbook.ensemble.model.EnsembleResult;

import java.util.List;

public interface ExplanationService {

    String explain(List<Object> playlistIds, EnsembleResult result);

}
