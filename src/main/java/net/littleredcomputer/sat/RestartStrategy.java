package net.littleredcomputer.sat;

public enum RestartStrategy {
    GEOMETRIC,  // threshold grows by a constant factor after every restart
    LUBY,       // threshold is the initial threshold times the Luby sequence 1,1,2,1,1,2,4,...
    NEVER
}
