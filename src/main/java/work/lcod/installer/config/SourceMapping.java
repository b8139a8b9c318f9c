package work.lcod.installer.config;

public record SourceMapping(String source, String destination) {}
