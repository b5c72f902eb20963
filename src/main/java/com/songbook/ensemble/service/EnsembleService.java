package com.songbook.ensemble.service;

import com.songbook.ensemble.model.EnsembleCommand;
import com.songbook.ensemble.model.EnsembleResult;

public interface EnsembleService {

    EnsembleResult aggregate(EnsembleCommand command);

}
