package com.asciify.API;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Checks uploaded files before they are decoded. Nothing is written to disk; the bytes go straight to the sampler.
 */
@Slf4j
@Service
public class ImageUploadService {

	/**
	 * True for a non-empty file with an {@code image/*} content type and a jpg, jpeg, png, gif, bmp or webp name.
	 */
	public boolean isValidImageFile(MultipartFile file) {
		if (file == null || file.isEmpty()) return false;

		String contentType = file.getContentType();
		if (contentType == null || !contentType.startsWith("image/")) {
			return false;
		}

		String originalFilename = file.getOriginalFilename();
		return originalFilename != null &&
				originalFilename.matches("(?i).+\\.(jpg|jpeg|png|gif|bmp|webp)$");
	}

	/**
	 * Returns the upload's bytes, or throws {@link InvalidUploadException} if it does not look like an image.
	 */
	public byte[] readImage(MultipartFile file) throws IOException {
		if (!isValidImageFile(file)) {
			String name = file == null ? null : file.getOriginalFilename();
			log.warn("Rejected upload {}", name);
			throw new InvalidUploadException("Not a supported image file: " + name);
		}
		byte[] bytes = file.getBytes();
		log.info("Received {} ({} bytes)", file.getOriginalFilename(), bytes.length);
		return bytes;
	}
}
